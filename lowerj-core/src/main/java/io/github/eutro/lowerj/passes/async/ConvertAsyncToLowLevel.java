package io.github.eutro.lowerj.passes.async;

import io.github.eutro.lowerj.conversion.AsyncRuntimeTypeConverter;
import io.github.eutro.lowerj.conversion.ConversionDriver;
import io.github.eutro.lowerj.conversion.ConversionReport;
import io.github.eutro.lowerj.conversion.ConversionTarget;
import io.github.eutro.lowerj.conversion.LegalizationException;
import io.github.eutro.lowerj.conversion.LowLevelTypeConverter;
import io.github.eutro.lowerj.conversion.RewritePatternSet;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.passes.IRPass;
import io.github.eutro.lowerj.passes.structural.FuncConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers coroutine primitives and runtime operations to low-level operations and calls into
 * the async runtime, converting function signatures, calls and returns along the way.
 * <p>
 * This is a partial conversion: operations of the async family that no pattern handles, such as
 * {@code async.execute}, are left in place and listed in the returned report. A
 * {@link #STRICT strict} instance throws instead.
 */
public class ConvertAsyncToLowLevel implements IRPass<Module, ConversionReport> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConvertAsyncToLowLevel.class);

    public static final ConvertAsyncToLowLevel INSTANCE = new ConvertAsyncToLowLevel(false);
    public static final ConvertAsyncToLowLevel STRICT = new ConvertAsyncToLowLevel(true);

    private final boolean strict;

    private ConvertAsyncToLowLevel(boolean strict) {
        this.strict = strict;
    }

    @Override
    public ConversionReport run(Module module) {
        TypeConverter converter = new AsyncRuntimeTypeConverter();
        TypeConverter payloadConverter = new TypeConverter(new LowLevelTypeConverter())
                .addConversion(AsyncRuntimeTypeConverter::convertAsyncTypes);
        AsyncRuntimeApi api = new AsyncRuntimeApi(module);

        ConversionTarget target = new ConversionTarget()
                .addLegalOp(StdOps.CONSTANT)
                .addLegalDialect(LlvmOps.DIALECT)
                .addIllegalDialect(AsyncOps.DIALECT);
        RewritePatternSet patterns = new RewritePatternSet();
        FuncConversions.populate(converter, patterns, target);
        RuntimeLowerings.populate(converter, payloadConverter, api, patterns);
        CoroutineLowerings.populate(converter, api, patterns);

        ConversionReport report = ConversionDriver.applyPartialConversion(module, target, patterns);
        LOGGER.info("Lowered async operations with {} rewrites, {} left illegal",
                report.rewriteCount, report.residual.size());
        if (strict && !report.residual.isEmpty()) {
            throw new LegalizationException(report);
        }
        return report;
    }
}
