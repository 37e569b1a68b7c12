package io.github.eutro.lowerj.passes.meta;

import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRUtils;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Region;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the structure of a module, throwing an {@link IllegalStateException} listing every problem found.
 * <p>
 * Every block of an operation's region must end in exactly one terminator, every operand must be
 * defined before its use in the same block or in a block of an enclosing region, and successors
 * must be blocks of the same region. Branches pass no block arguments.
 */
public class VerifyIR implements InPlaceIRPass<Module> {
    public static final VerifyIR INSTANCE = new VerifyIR();

    @Override
    public void runInPlace(Module module) {
        List<String> problems = new ArrayList<>();
        IRUtils.walk(module, insn -> verifyInsn(insn, problems));
        if (!problems.isEmpty()) {
            throw new IllegalStateException("IR failed verification:\n  " + String.join("\n  ", problems));
        }
    }

    private static void verifyInsn(Insn insn, List<String> problems) {
        BasicBlock bb = insn.getBlock();
        assert bb != null;

        for (Region region : insn.getRegions()) {
            for (BasicBlock child : region.blocks) {
                List<Insn> insns = child.getInsns();
                if (insns.isEmpty()) {
                    problems.add("empty block " + child.toTargetString() + " in " + insn.op);
                    continue;
                }
                if (!insns.get(insns.size() - 1).isTerminator()) {
                    problems.add("block " + child.toTargetString() + " in " + insn.op + " is not terminated");
                }
            }
        }

        List<Insn> insns = bb.getInsns();
        if (insn.isTerminator() && insns.get(insns.size() - 1) != insn) {
            problems.add(insn.op + " terminates " + bb.toTargetString() + " before its end");
        }

        for (Var operand : insn.getOperands()) {
            if (!isVisible(operand, insn)) {
                problems.add(operand + " is used by " + insn.op + " out of its scope");
            }
        }

        if (insn.op.key == StdOps.BR && !insn.getOperands().isEmpty()
                || insn.op.key == StdOps.COND_BR && insn.getOperands().size() != 1) {
            problems.add(insn.op + " passes block arguments, which branches do not carry");
        }

        for (BasicBlock succ : insn.getSuccessors()) {
            if (succ.getRegion() != bb.getRegion()) {
                problems.add(insn.op + " branches to " + succ.toTargetString() + " in another region");
            }
        }
    }

    private static boolean isVisible(Var value, Insn user) {
        Insn def = value.getDefiningInsn();
        BasicBlock defBlock = def == null ? value.getOwningBlock() : def.getBlock();
        if (defBlock == null) return false;
        Region defRegion = defBlock.getRegion();

        // find the ancestor of the user that sits directly in the defining region
        Insn cursor = user;
        while (cursor != null) {
            BasicBlock cursorBlock = cursor.getBlock();
            if (cursorBlock == null) return false;
            if (cursorBlock.getRegion() == defRegion) {
                if (cursorBlock != defBlock) {
                    // no dominance analysis across blocks
                    return true;
                }
                if (def == null) return true;
                List<Insn> insns = defBlock.getInsns();
                return insns.indexOf(def) < insns.indexOf(cursor);
            }
            cursor = cursor.getParentInsn();
        }
        return false;
    }
}
