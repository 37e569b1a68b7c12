package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ir.IRUtils;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.passes.misc.ReconcileMaterializations;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.util.Pair;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites illegal operations with patterns until none are left, or no pattern applies.
 * <p>
 * Operations are visited from a first-in first-out worklist, seeded with every operation in
 * program order, and fed with the operations each successful pattern inserts. Each operation is
 * in the worklist at most once at a time, so the order, and so the result, is deterministic.
 * <p>
 * Successful rewrites are never undone, even if the conversion fails later.
 */
public final class ConversionDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionDriver.class);

    private final ConversionTarget target;
    private final RewritePatternSet patterns;
    private final ConversionConfig config;

    private final ArrayDeque<Insn> worklist = new ArrayDeque<>();
    private final Set<Insn> queued = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Insn, String> lastFailure = new IdentityHashMap<>();
    private int rewrites = 0;

    private ConversionDriver(ConversionTarget target, RewritePatternSet patterns, ConversionConfig config) {
        this.target = target;
        this.patterns = patterns;
        this.config = config;
    }

    /**
     * Run a conversion over a module.
     *
     * @param module   The module, which is rewritten in place.
     * @param target   Which operations are legal.
     * @param patterns The patterns to rewrite illegal operations with.
     * @param config   The settings of the run.
     * @return The report of the run.
     */
    public static ConversionReport run(Module module, ConversionTarget target, RewritePatternSet patterns, ConversionConfig config) {
        return new ConversionDriver(target, patterns, config).drive(module);
    }

    /**
     * Run a {@link ConversionMode#PARTIAL partial} conversion, which does not fail if illegal operations are left.
     *
     * @param module   The module.
     * @param target   Which operations are legal.
     * @param patterns The patterns.
     * @return The report, listing the operations left illegal.
     */
    public static ConversionReport applyPartialConversion(Module module, ConversionTarget target, RewritePatternSet patterns) {
        return run(module, target, patterns, ConversionConfig.PARTIAL);
    }

    /**
     * Run a {@link ConversionMode#FULL full} conversion.
     *
     * @param module   The module.
     * @param target   Which operations are legal.
     * @param patterns The patterns.
     * @return The report.
     * @throws LegalizationException If any illegal operation is left.
     */
    public static ConversionReport applyFullConversion(Module module, ConversionTarget target, RewritePatternSet patterns) {
        ConversionReport report = run(module, target, patterns, ConversionConfig.FULL);
        if (report.failed()) {
            throw new LegalizationException(report);
        }
        return report;
    }

    private void enqueue(Insn insn) {
        if (queued.add(insn)) {
            worklist.add(insn);
        }
    }

    private ConversionReport drive(Module module) {
        IRUtils.walk(module, this::enqueue);
        Insn insn;
        while ((insn = worklist.poll()) != null) {
            queued.remove(insn);
            if (insn.isErased() || insn.getBlock() == null) continue;
            if (target.isLegal(insn, config.mode)) continue;
            legalize(insn);
        }

        if (config.reconcileMaterializations) {
            ReconcileMaterializations.INSTANCE.runInPlace(module);
        }

        List<Insn> residual = new ArrayList<>();
        List<Pair<Insn, String>> failures = new ArrayList<>();
        IRUtils.walk(module, it -> {
            if (!target.isLegal(it, config.mode)) {
                residual.add(it);
                failures.add(Pair.of(it, lastFailure.getOrDefault(it, "no pattern applied")));
            }
        });
        ConversionReport report = new ConversionReport(config.mode, rewrites, residual, failures);
        if (!residual.isEmpty()) {
            LOGGER.warn("{} illegal operations left after {} conversion, first is {}",
                    residual.size(), config.mode, residual.get(0).op);
        }
        LOGGER.debug("{}", report);
        return report;
    }

    private void legalize(Insn insn) {
        List<ConversionPattern> candidates = patterns.get(insn.op.key);
        if (candidates.isEmpty()) {
            lastFailure.put(insn, "no pattern for " + insn.op.key);
            return;
        }
        for (ConversionPattern pattern : candidates) {
            if (rewrites >= config.maxRewrites) {
                throw new LegalizationException("rewrite budget of " + config.maxRewrites
                        + " exhausted at " + insn + ", the patterns may not terminate");
            }
            ConversionRewriter rewriter = new ConversionRewriter(insn);
            boolean success;
            try {
                List<Var> operands = remapOperands(insn, pattern.getTypeConverter(), rewriter);
                success = operands == null
                        ? rewriter.notifyMatchFailure(insn, "operand types have no conversion")
                        : pattern.matchAndRewrite(insn, operands, rewriter);
            } catch (RuntimeException e) {
                rewriter.rollback();
                e.addSuppressed(new RuntimeException("applying " + pattern + " to " + insn));
                throw e;
            }
            if (success) {
                List<Insn> inserted = rewriter.commit();
                rewrites++;
                lastFailure.remove(insn);
                LOGGER.debug("{} rewrote {} into {} operations", pattern, insn.op, inserted.size());
                inserted.forEach(this::enqueue);
                return;
            }
            String reason = rewriter.getFailureReason();
            rewriter.rollback();
            lastFailure.put(insn, pattern + ": " + (reason == null ? "did not match" : reason));
        }
    }

    private @Nullable List<Var> remapOperands(Insn insn, @Nullable TypeConverter converter, ConversionRewriter rewriter) {
        List<Var> operands = insn.getOperands();
        if (converter == null) return new ArrayList<>(operands);
        List<Var> remapped = new ArrayList<>(operands.size());
        for (Var operand : operands) {
            Optional<Type> converted = converter.convertType(operand.getType());
            if (converted.isEmpty()) return null;
            Type type = converted.get();
            Insn def = operand.getDefiningInsn();
            if (def != null && BuiltinOps.isMaterialization(def)
                    && def.getOperands().get(0).getType().equals(type)) {
                remapped.add(def.getOperands().get(0));
            } else if (operand.getType().equals(type)) {
                remapped.add(operand);
            } else {
                remapped.add(converter.materialize(rewriter, operand, type));
            }
        }
        return remapped;
    }
}
