package io.github.eutro.lowerj.test;

import io.github.eutro.lowerj.conversion.ConversionMode;
import io.github.eutro.lowerj.conversion.ConversionTarget;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.types.Types;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionTargetTest {
    @Test
    void testDialectBeforeKind() {
        ConversionTarget target = new ConversionTarget()
                .addLegalDialect(LlvmOps.DIALECT)
                .addIllegalOp(LlvmOps.CONSTANT);
        Insn constant = LlvmOps.constant(0, Types.I32);
        assertEquals(Boolean.TRUE, target.getDeclaredLegality(constant));

        target = new ConversionTarget()
                .addIllegalDialect(StdOps.DIALECT)
                .addDynamicallyLegalOp(op -> true, StdOps.RETURN);
        assertFalse(target.isLegal(StdOps.ret(), ConversionMode.PARTIAL));
    }

    @Test
    void testKindDeclarations() {
        ConversionTarget target = new ConversionTarget()
                .addLegalOp(StdOps.CONSTANT)
                .addIllegalOp(StdOps.BR);
        assertTrue(target.isLegal(StdOps.constant(1, Types.I32), ConversionMode.FULL));
        assertFalse(target.isLegal(Utils.br(new BasicBlock()), ConversionMode.PARTIAL));
    }

    @Test
    void testDynamicPredicateSeesCurrentTypes() {
        TypeConverter converter = new TypeConverter()
                .addIdentityConversion()
                .addConversion(t -> t.equals(Types.INDEX) ? Optional.of(Types.I64) : null);
        ConversionTarget target = new ConversionTarget()
                .addDynamicallyLegalOp(op -> converter.isLegal(op.getOperandTypes()), StdOps.RETURN);

        Var value = Utils.produce(Types.INDEX).result();
        Insn ret = StdOps.ret(value);
        assertFalse(target.isLegal(ret, ConversionMode.PARTIAL));
        value.setType(Types.I64);
        assertTrue(target.isLegal(ret, ConversionMode.FULL));
    }

    @Test
    void testModeDefault() {
        ConversionTarget target = new ConversionTarget();
        Insn produce = Utils.produce(Types.I32);
        assertNull(target.getDeclaredLegality(produce));
        assertFalse(target.isLegal(produce, ConversionMode.FULL));
        assertTrue(target.isLegal(produce, ConversionMode.PARTIAL));
    }

    @Test
    void testMaterializationsAlwaysLegal() {
        ConversionTarget target = new ConversionTarget()
                .addIllegalDialect(BuiltinOps.DIALECT);
        Var value = Utils.produce(Types.I32).result();
        Insn plainCast = BuiltinOps.cast(value, Types.I64);
        assertFalse(target.isLegal(plainCast, ConversionMode.PARTIAL));

        Insn materialization = new TypeConverter().materialize(
                new IRBuilder(new BasicBlock()),
                value, Types.I64).getDefiningInsn();
        assertNotNull(materialization);
        assertTrue(target.isLegal(materialization, ConversionMode.FULL));
    }
}
