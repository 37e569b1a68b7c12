/**
 * The ext API associates arbitrary, typed data with pieces of the IR.
 *
 * <pre>{@code
 * public static final Ext<Boolean> VISITED = Ext.create(Boolean.class, "VISITED");
 *
 * insn.attachExt(VISITED, true);
 * insn.getExt(VISITED).orElse(false); // => true
 * }</pre>
 * <p>
 * Passes use this for scratch data, and operation families use it to describe
 * their {@link io.github.eutro.lowerj.ops.OpKey keys} (terminators, symbols)
 * without a class per operation kind.
 * <p>
 * Some containers store frequently used exts, such as the owner of an operation,
 * directly in fields.
 */
package io.github.eutro.lowerj.ext;
