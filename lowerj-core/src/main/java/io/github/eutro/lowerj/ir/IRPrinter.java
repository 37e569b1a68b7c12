package io.github.eutro.lowerj.ir;

import io.github.eutro.lowerj.types.Type;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prints the operation graph in a deterministic textual form.
 * <p>
 * Values are numbered in definition order and blocks in the order their regions are
 * entered, so two structurally identical graphs print identically.
 */
public final class IRPrinter {
    private final Map<Var, Integer> vars = new IdentityHashMap<>();
    private final Map<BasicBlock, Integer> blocks = new IdentityHashMap<>();
    private final StringBuilder sb = new StringBuilder();

    private IRPrinter() {
    }

    /**
     * Print a module.
     *
     * @param module The module.
     * @return The text.
     */
    public static String print(Module module) {
        IRPrinter printer = new IRPrinter();
        printer.sb.append("module ");
        printer.printRegion(module.body, 0);
        printer.sb.append('\n');
        return printer.sb.toString();
    }

    /**
     * Print a single operation and everything nested in it.
     *
     * @param insn The operation.
     * @return The text.
     */
    public static String print(Insn insn) {
        IRPrinter printer = new IRPrinter();
        printer.printInsn(insn, 0);
        return printer.sb.toString();
    }

    private String name(Var var) {
        Integer n = vars.get(var);
        if (n == null) {
            // defined outside what is being printed, or not yet (a dominance violation)
            return "%?" + var.name;
        }
        return "%" + n;
    }

    private void define(Var var) {
        vars.put(var, vars.size());
    }

    private String name(BasicBlock bb) {
        Integer n = blocks.get(bb);
        return n == null ? "^?" : "^bb" + n;
    }

    private static String types(List<Type> types) {
        return types.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
    }

    private void indent(int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
    }

    private void printRegion(Region region, int depth) {
        for (BasicBlock bb : region.blocks) {
            blocks.put(bb, blocks.size());
        }
        sb.append("{\n");
        for (BasicBlock bb : region.blocks) {
            indent(depth);
            sb.append(name(bb));
            if (!bb.getArgs().isEmpty()) {
                sb.append('(');
                boolean first = true;
                for (Var arg : bb.getArgs()) {
                    if (!first) sb.append(", ");
                    first = false;
                    define(arg);
                    sb.append(name(arg)).append(": ").append(arg.getType());
                }
                sb.append(')');
            }
            sb.append(":\n");
            for (Insn insn : bb.getInsns()) {
                printInsn(insn, depth + 1);
            }
        }
        indent(depth);
        sb.append('}');
    }

    private void printInsn(Insn insn, int depth) {
        indent(depth);
        String operands = insn.getOperands().stream().map(this::name).collect(Collectors.joining(", "));
        for (Var result : insn.getResults()) {
            define(result);
        }
        if (!insn.getResults().isEmpty()) {
            sb.append(insn.getResults().stream().map(this::name).collect(Collectors.joining(", ")))
                    .append(" = ");
        }
        sb.append(insn.op);
        if (!operands.isEmpty()) {
            sb.append(' ').append(operands);
        }
        if (!insn.getSuccessors().isEmpty()) {
            sb.append(insn.getSuccessors().stream().map(this::name).collect(Collectors.joining(", ", " [", "]")));
        }
        sb.append(" : ").append(types(insn.getOperandTypes()))
                .append(" -> ").append(types(insn.getResultTypes()));
        for (Region region : insn.getRegions()) {
            sb.append(' ');
            printRegion(region, depth);
        }
        sb.append('\n');
    }
}
