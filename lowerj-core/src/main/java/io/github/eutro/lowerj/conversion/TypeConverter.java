package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A set of rules for converting types from one representation to another.
 * <p>
 * Rules are tried in reverse order of registration, so later rules take priority.
 * If no rule matches, the type is handed to the inner converter, if any, which lets
 * one converter be layered on top of another. A type no rule matches has no conversion.
 * <p>
 * Rules that convert nested types should recurse through {@link #outermost()}, so that
 * rules layered on top also apply to the nested types.
 */
public class TypeConverter {
    /**
     * A single conversion rule.
     */
    @FunctionalInterface
    public interface ConversionRule {
        /**
         * Convert a type.
         *
         * @param type The type.
         * @return null if this rule does not apply to {@code type}, the empty optional
         * if the type applies but has no representation, or the converted type.
         */
        @Nullable Optional<Type> convert(Type type);
    }

    private final List<ConversionRule> rules = new ArrayList<>();
    private final @Nullable TypeConverter inner;
    private @Nullable TypeConverter outer = null;
    private final Map<Type, Optional<Type>> cache = new HashMap<>();

    /**
     * Construct a converter with no rules.
     */
    public TypeConverter() {
        this(null);
    }

    /**
     * Construct a converter which defers to {@code inner} for the types none of its own rules match.
     *
     * @param inner The inner converter.
     * @throws IllegalStateException If {@code inner} is already wrapped by another converter.
     */
    public TypeConverter(@Nullable TypeConverter inner) {
        this.inner = inner;
        if (inner != null) {
            if (inner.outer != null) {
                throw new IllegalStateException("converter is already wrapped");
            }
            inner.outer = this;
            inner.cache.clear();
        }
    }

    /**
     * Get the converter wrapping this one, through any number of layers, or this if there is none.
     *
     * @return The outermost converter.
     */
    public TypeConverter outermost() {
        TypeConverter it = this;
        while (it.outer != null) it = it.outer;
        return it;
    }

    /**
     * Register a rule, which is tried before every rule registered so far.
     *
     * @param rule The rule.
     * @return This.
     */
    public TypeConverter addConversion(ConversionRule rule) {
        rules.add(rule);
        // layers on top may have cached what this used to answer
        for (TypeConverter it = this; it != null; it = it.outer) {
            it.cache.clear();
        }
        return this;
    }

    /**
     * Register a rule which converts every type to itself. Registered first,
     * this makes every type no other rule matches legal.
     *
     * @return This.
     */
    public TypeConverter addIdentityConversion() {
        return addConversion(Optional::of);
    }

    /**
     * Convert a type.
     *
     * @param type The type.
     * @return The converted type, or empty if it has no conversion.
     */
    public Optional<Type> convertType(Type type) {
        Optional<Type> cached = cache.get(type);
        if (cached != null) return cached;
        // not computeIfAbsent, rules may convert recursively
        Optional<Type> result = convertUncached(type);
        cache.put(type, result);
        return result;
    }

    private Optional<Type> convertUncached(Type type) {
        for (int i = rules.size() - 1; i >= 0; i--) {
            Optional<Type> converted = rules.get(i).convert(type);
            if (converted != null) return converted;
        }
        if (inner != null) return inner.convertType(type);
        return Optional.empty();
    }

    /**
     * Convert every type in a list.
     *
     * @param types The types.
     * @return The converted types, or empty if any of them has no conversion.
     */
    public Optional<List<Type>> convertTypes(List<Type> types) {
        List<Type> converted = new ArrayList<>(types.size());
        for (Type type : types) {
            Optional<Type> c = convertType(type);
            if (c.isEmpty()) return Optional.empty();
            converted.add(c.get());
        }
        return Optional.of(converted);
    }

    /**
     * Convert each parameter and result of a function type.
     *
     * @param type The function type.
     * @return The converted function type, or empty if any part has no conversion.
     */
    public Optional<FunctionType> convertSignature(FunctionType type) {
        Optional<List<Type>> params = convertTypes(type.params);
        if (params.isEmpty()) return Optional.empty();
        Optional<List<Type>> results = convertTypes(type.results);
        if (results.isEmpty()) return Optional.empty();
        return Optional.of(Types.function(params.get(), results.get()));
    }

    /**
     * Whether a type converts to itself.
     *
     * @param type The type.
     * @return Whether it is legal.
     */
    public boolean isLegal(Type type) {
        return convertType(type).map(type::equals).orElse(false);
    }

    /**
     * Whether every type in a list converts to itself.
     *
     * @param types The types.
     * @return Whether they are all legal.
     */
    public boolean isLegal(List<Type> types) {
        for (Type type : types) {
            if (!isLegal(type)) return false;
        }
        return true;
    }

    /**
     * Whether the operand and result types of an operation all convert to themselves.
     *
     * @param insn The operation.
     * @return Whether its types are legal.
     */
    public boolean isLegal(Insn insn) {
        return isLegal(insn.getOperandTypes()) && isLegal(insn.getResultTypes());
    }

    /**
     * Whether every parameter and result of a function type converts to itself.
     *
     * @param type The function type.
     * @return Whether it is legal.
     */
    public boolean isSignatureLegal(FunctionType type) {
        return isLegal(type.params) && isLegal(type.results);
    }

    /**
     * Insert a cast of a value to another type, marked as a materialization.
     *
     * @param ib     The builder to insert with.
     * @param value  The value.
     * @param target The type to cast to.
     * @return The cast value.
     */
    public Var materialize(IRBuilder ib, Var value, Type target) {
        Insn cast = BuiltinOps.cast(value, target);
        cast.attachExt(CommonExts.IS_MATERIALIZATION, true);
        return ib.insertResult(cast);
    }
}
