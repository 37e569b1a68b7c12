package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Structured control flow, where control constructs own their bodies as regions.
 */
public class ScfOps {
    public static final Dialect DIALECT = new Dialect("scf");

    /**
     * A bounded loop. Operands are the lower bound, upper bound and step, followed by the initial
     * values of the loop-carried variables. The body's entry block takes the induction variable
     * and the loop-carried variables, and yields their next values. Results are their final values.
     */
    public static final SimpleOpKey FOR = new SimpleOpKey(DIALECT, "for");
    /**
     * A two-armed conditional on an i1 operand. Each arm is a region whose yield gives the results.
     */
    public static final SimpleOpKey IF = new SimpleOpKey(DIALECT, "if");
    /**
     * Control: ends a region of a {@link #FOR} or {@link #IF}, giving the values of its parent.
     */
    public static final SimpleOpKey YIELD = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "yield"));

    /**
     * Create a detached loop with an empty body block.
     *
     * @param lb    The lower bound.
     * @param ub    The upper bound.
     * @param step  The step.
     * @param inits The initial values of the loop-carried variables.
     * @return The loop.
     */
    public static Insn forLoop(Var lb, Var ub, Var step, List<Var> inits) {
        List<Var> operands = new ArrayList<>(Arrays.asList(lb, ub, step));
        operands.addAll(inits);
        List<Type> carried = new ArrayList<>();
        for (Var init : inits) {
            carried.add(init.getType());
        }
        Insn loop = FOR.create().insn(operands).returning(carried).withRegions(1);
        List<Type> argTypes = new ArrayList<>();
        argTypes.add(Types.INDEX);
        argTypes.addAll(carried);
        loop.getRegion(0).newBlock(argTypes.toArray(new Type[0]));
        return loop;
    }

    /**
     * Create a detached conditional, with an empty block in each arm.
     *
     * @param cond        The condition.
     * @param resultTypes The result types.
     * @return The conditional.
     */
    public static Insn ifElse(Var cond, List<Type> resultTypes) {
        Insn insn = IF.create().insn(cond).returning(resultTypes).withRegions(2);
        insn.getRegion(0).newBlock();
        insn.getRegion(1).newBlock();
        return insn;
    }

    public static Insn yield(Var... values) {
        return YIELD.create().insn(values);
    }
}
