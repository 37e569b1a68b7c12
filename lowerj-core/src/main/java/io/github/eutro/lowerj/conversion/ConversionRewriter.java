package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.IRUtils;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Region;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.util.Pair;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * The builder a {@link ConversionPattern} makes all of its changes through.
 * <p>
 * Every change is recorded, so that a failed pattern can be {@link #rollback() rolled back},
 * leaving the graph as it was before the pattern ran. Replacing and erasing operations
 * is deferred until the pattern is {@link #commit() committed}.
 */
public class ConversionRewriter extends IRBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionRewriter.class);

    private final Deque<Runnable> undo = new ArrayDeque<>();
    private final List<Insn> inserted = new ArrayList<>();
    // a null replacement list means erasure
    private final List<Pair<Insn, List<Var>>> replaced = new ArrayList<>();
    private @Nullable String failureReason;

    /**
     * Construct a rewriter inserting before an operation.
     *
     * @param op The operation, which must be in a block.
     */
    public ConversionRewriter(Insn op) {
        super(op);
    }

    @Override
    public Insn insert(Insn insn) {
        super.insert(insn);
        inserted.add(insn);
        undo.push(insn::erase);
        return insn;
    }

    /**
     * Insert a copy of an operation without its regions, see {@link IRUtils#cloneWithoutRegions(Insn)}.
     *
     * @param op The operation.
     * @return The inserted copy.
     */
    public Insn cloneWithoutRegions(Insn op) {
        return insert(IRUtils.cloneWithoutRegions(op));
    }

    public void setOperand(Insn insn, int i, Var value) {
        Var old = insn.getOperands().set(i, value);
        undo.push(() -> insn.getOperands().set(i, old));
    }

    public void setOperands(Insn insn, List<Var> values) {
        List<Var> operands = insn.getOperands();
        List<Var> old = new ArrayList<>(operands);
        operands.clear();
        operands.addAll(values);
        undo.push(() -> {
            operands.clear();
            operands.addAll(old);
        });
    }

    public void setType(Var var, Type type) {
        Type old = var.getType();
        var.setType(type);
        undo.push(() -> var.setType(old));
    }

    /**
     * Make every use of {@code from} use {@code to} instead, immediately.
     *
     * @param from The value to replace.
     * @param to   The replacement.
     */
    public void replaceAllUsesWith(Var from, Var to) {
        replaceUsesExcept(from, to, null);
    }

    private void replaceUsesExcept(Var from, Var to, @Nullable Insn except) {
        if (from == to) return;
        for (Insn user : new LinkedHashSet<>(from.getUses())) {
            if (user == except) continue;
            List<Var> operands = user.getOperands();
            for (int i = 0; i < operands.size(); i++) {
                if (operands.get(i) == from) {
                    setOperand(user, i, to);
                }
            }
        }
    }

    /**
     * Move every block of {@code source} into {@code dest}, before {@code before}.
     * The blocks keep their identity and contents.
     *
     * @param source The region to empty.
     * @param dest   The region to move the blocks to.
     * @param before The block in {@code dest} to move them before, or null to move them to the end.
     */
    public void inlineRegionBefore(Region source, Region dest, @Nullable BasicBlock before) {
        List<BasicBlock> moved = new ArrayList<>(source.blocks);
        source.blocks.clear();
        int at = before == null ? dest.blocks.size() : dest.blocks.indexOf(before);
        if (at < 0) {
            source.blocks.addAll(moved);
            throw new IllegalArgumentException("block to inline before is not in the destination region");
        }
        dest.blocks.addAll(at, moved);
        undo.push(() -> {
            for (int i = 0; i < moved.size(); i++) {
                dest.blocks.remove(at);
            }
            source.blocks.addAll(moved);
        });
    }

    /**
     * Convert the argument types of a region's entry block in place.
     * <p>
     * Existing uses of a retyped argument are redirected through a cast back to its old type,
     * inserted at the start of the block.
     *
     * @param region    The region.
     * @param converter The converter.
     * @return Whether every argument type could be converted. Nothing is changed if not.
     */
    public boolean convertRegionTypes(Region region, TypeConverter converter) {
        BasicBlock entry = region.getEntryBlock();
        if (entry == null) return true;
        Optional<List<Type>> newTypes = converter.convertTypes(entry.getArgTypes());
        if (newTypes.isEmpty()) return false;

        BasicBlock savedBlock = getBlock();
        Insn savedAnchor = getAnchor();
        List<Var> args = entry.getArgs();
        for (int i = 0; i < args.size(); i++) {
            Var arg = args.get(i);
            Type oldType = arg.getType();
            Type newType = newTypes.get().get(i);
            if (oldType.equals(newType)) continue;
            if (arg.hasUses()) {
                setInsertionPointToStart(entry);
                Var cast = converter.materialize(this, arg, oldType);
                replaceUsesExcept(arg, cast, cast.getDefiningInsn());
            }
            setType(arg, newType);
        }
        setInsertionPoint(savedBlock, savedAnchor);
        return true;
    }

    /**
     * Replace the results of an operation with other values, and erase it, once the pattern succeeds.
     *
     * @param op     The operation.
     * @param values The replacement for each result.
     */
    public void replaceOp(Insn op, List<Var> values) {
        if (values.size() != op.getResults().size()) {
            throw new IllegalArgumentException("replacing " + op.getResults().size() + " results of "
                    + op.op + " with " + values.size() + " values");
        }
        replaced.add(Pair.of(op, List.copyOf(values)));
    }

    /**
     * Insert an operation, and replace {@code op} with its results.
     *
     * @param op     The operation to replace.
     * @param newOp  The detached replacement.
     * @return The replacement.
     */
    public Insn replaceOpWithNew(Insn op, Insn newOp) {
        insert(newOp);
        replaceOp(op, newOp.getResults());
        return newOp;
    }

    /**
     * Erase an operation, whose results must be unused, once the pattern succeeds.
     *
     * @param op The operation.
     */
    public void eraseOp(Insn op) {
        replaced.add(Pair.of(op, null));
    }

    /**
     * Record why a pattern did not apply.
     *
     * @param op     The operation the pattern was applied to.
     * @param reason The reason.
     * @return {@code false}, to be returned from the pattern.
     */
    public boolean notifyMatchFailure(Insn op, String reason) {
        failureReason = reason;
        LOGGER.trace("match failure on {}: {}", op.op, reason);
        return false;
    }

    public @Nullable String getFailureReason() {
        return failureReason;
    }

    /**
     * Undo every recorded change, most recent first.
     */
    public void rollback() {
        while (!undo.isEmpty()) {
            undo.pop().run();
        }
        inserted.clear();
        replaced.clear();
    }

    /**
     * Apply the deferred replacements and erasures.
     * <p>
     * Where a replacement value's type differs from the result it replaces, remaining users are
     * given a cast of the replacement back to the old type.
     *
     * @return The operations inserted by the pattern that are still in the graph.
     */
    public List<Insn> commit() {
        for (Pair<Insn, List<Var>> replacement : replaced) {
            Insn op = replacement.left;
            List<Var> values = replacement.right;
            if (values == null) continue;
            List<Var> results = op.getResults();
            for (int i = 0; i < results.size(); i++) {
                Var result = results.get(i);
                Var value = values.get(i);
                if (!result.hasUses() || result == value) continue;
                if (!result.getType().equals(value.getType())) {
                    Insn cast = BuiltinOps.cast(value, result.getType());
                    cast.attachExt(CommonExts.IS_MATERIALIZATION, true);
                    value = new IRBuilder(op).insertResult(cast);
                }
                result.replaceAllUsesWith(value);
            }
        }
        for (Pair<Insn, List<Var>> replacement : replaced) {
            if (!replacement.left.isErased()) {
                replacement.left.erase();
            }
        }
        List<Insn> live = new ArrayList<>();
        for (Insn insn : inserted) {
            if (!insn.isErased()) live.add(insn);
        }
        undo.clear();
        inserted.clear();
        replaced.clear();
        return Collections.unmodifiableList(live);
    }
}
