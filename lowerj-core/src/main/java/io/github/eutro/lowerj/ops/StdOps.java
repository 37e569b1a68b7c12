package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.Type;

import java.util.Arrays;
import java.util.List;

/**
 * Functions, calls, constants and unstructured control flow.
 */
public class StdOps {
    public static final Dialect DIALECT = new Dialect("std");

    /**
     * Defines a function. Has one region, the body, whose entry block takes the parameters.
     * Declarations have an empty body.
     */
    public static final UnaryOpKey<FuncSignature> FUNC = new UnaryOpKey<>(DIALECT, "func");
    /**
     * Effect: calls a function by symbol.
     */
    public static final UnaryOpKey<Callee> CALL = new UnaryOpKey<>(DIALECT, "call");
    /**
     * Effect: returns the constant, typed as its result.
     */
    public static final UnaryOpKey<Object> CONSTANT = CommonExts.markPure(new UnaryOpKey<Object>(DIALECT, "constant"));

    /**
     * Control: returns its operands from the enclosing function.
     */
    public static final SimpleOpKey RETURN = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "return"));
    /**
     * Control: jumps to its only successor. It takes no operands, and passes no block arguments.
     */
    public static final SimpleOpKey BR = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "br"));
    /**
     * Control: jumps to its first successor if its i1 operand is set, its second otherwise.
     * Like {@link #BR}, it passes no block arguments.
     */
    public static final SimpleOpKey COND_BR = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "cond_br"));

    static {
        FUNC.attachExt(CommonExts.SYMBOL_NAME, op -> FUNC.cast(op).arg.name);
    }

    /**
     * Create a detached function definition with an entry block taking the parameters.
     *
     * @param name The symbol.
     * @param type The type.
     * @return The function.
     */
    public static Insn func(String name, FunctionType type) {
        Insn insn = FUNC.create(new FuncSignature(name, type, false)).insn().withRegions(1);
        insn.getRegion(0).newBlock(type.params.toArray(new Type[0]));
        return insn;
    }

    /**
     * Create a detached private function declaration, with no body.
     *
     * @param name The symbol.
     * @param type The type.
     * @return The declaration.
     */
    public static Insn declare(String name, FunctionType type) {
        return FUNC.create(new FuncSignature(name, type, true)).insn().withRegions(1);
    }

    /**
     * Get the entry block of a function definition.
     *
     * @param func The function.
     * @return The block.
     */
    public static BasicBlock entry(Insn func) {
        BasicBlock entry = func.getRegion(0).getEntryBlock();
        if (entry == null) {
            throw new IllegalArgumentException(func.op + " is a declaration");
        }
        return entry;
    }

    public static Insn call(String name, FunctionType type, Var... args) {
        return call(name, type, Arrays.asList(args));
    }

    public static Insn call(String name, FunctionType type, List<Var> args) {
        return CALL.create(new Callee(name, type)).insn(args).returning(type.results);
    }

    public static Insn constant(Object value, Type type) {
        return CONSTANT.create(value).insn().returning(type);
    }

    public static Insn ret(Var... values) {
        return RETURN.create().insn(values);
    }
}
