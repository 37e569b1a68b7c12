package io.github.eutro.lowerj.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * A set of utilities for working with the operation graph.
 */
public class IRUtils {
    /**
     * Visit an operation and every operation nested in its regions, in pre-order.
     * <p>
     * The walk uses an explicit stack, so arbitrarily deep nesting is fine. Nested
     * operations are read after their parent is visited, so the visitor may
     * change the parent's regions.
     *
     * @param root    The operation.
     * @param visitor The visitor.
     */
    public static void walk(Insn root, Consumer<Insn> visitor) {
        Deque<Insn> stack = new ArrayDeque<>();
        stack.push(root);
        drain(stack, visitor);
    }

    /**
     * Visit every operation in a region, in pre-order.
     *
     * @param region  The region.
     * @param visitor The visitor.
     */
    public static void walk(Region region, Consumer<Insn> visitor) {
        Deque<Insn> stack = new ArrayDeque<>();
        pushRegion(stack, region);
        drain(stack, visitor);
    }

    /**
     * Visit every operation in a module, in pre-order.
     *
     * @param module  The module.
     * @param visitor The visitor.
     */
    public static void walk(Module module, Consumer<Insn> visitor) {
        walk(module.body, visitor);
    }

    /**
     * Collect every operation in a module, in pre-order.
     *
     * @param module The module.
     * @return The operations.
     */
    public static List<Insn> collect(Module module) {
        List<Insn> insns = new ArrayList<>();
        walk(module, insns::add);
        return insns;
    }

    private static void drain(Deque<Insn> stack, Consumer<Insn> visitor) {
        while (!stack.isEmpty()) {
            Insn insn = stack.pop();
            visitor.accept(insn);
            List<Region> regions = insn.getRegions();
            for (int i = regions.size() - 1; i >= 0; i--) {
                pushRegion(stack, regions.get(i));
            }
        }
    }

    private static void pushRegion(Deque<Insn> stack, Region region) {
        List<BasicBlock> blocks = region.blocks;
        for (int i = blocks.size() - 1; i >= 0; i--) {
            List<Insn> insns = blocks.get(i).getInsns();
            for (int j = insns.size() - 1; j >= 0; j--) {
                stack.push(insns.get(j));
            }
        }
    }

    /**
     * Create a detached copy of an operation with the same kind, operands, result types
     * and successors, and the same number of regions, all empty.
     *
     * @param insn The operation.
     * @return The copy.
     */
    public static Insn cloneWithoutRegions(Insn insn) {
        return new Insn(insn.op, insn.getOperands())
                .returning(insn.getResultTypes())
                .withRegions(insn.getRegions().size())
                .jumpsTo(insn.getSuccessors());
    }

    /**
     * Whether {@code ancestor} is {@code insn} or one of the operations it is nested in.
     *
     * @param ancestor The potential ancestor.
     * @param insn     The operation.
     * @return Whether it is an ancestor.
     */
    public static boolean isAncestor(Insn ancestor, Insn insn) {
        for (Insn it = insn; it != null; it = it.getParentInsn()) {
            if (it == ancestor) return true;
        }
        return false;
    }

    /**
     * Get the module an operation is ultimately nested in.
     *
     * @param insn The operation.
     * @return The module, or null if some ancestor is detached.
     */
    public static @Nullable Module getModule(Insn insn) {
        Insn top = insn;
        while (top.getParentInsn() != null) {
            top = top.getParentInsn();
        }
        BasicBlock bb = top.getBlock();
        if (bb == null) return null;
        Region region = bb.getRegion();
        return region == null ? null : region.getModule();
    }

    /**
     * Get the region a value is defined in.
     *
     * @param var The value.
     * @return The region, or null if its definition is detached.
     */
    public static @Nullable Region getDefiningRegion(Var var) {
        BasicBlock bb = var.getOwningBlock();
        if (bb == null) {
            Insn def = var.getDefiningInsn();
            bb = def == null ? null : def.getBlock();
        }
        return bb == null ? null : bb.getRegion();
    }
}
