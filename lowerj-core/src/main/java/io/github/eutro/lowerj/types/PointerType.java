package io.github.eutro.lowerj.types;

/**
 * {@code !llvm.ptr<T>}: a low-level pointer to a {@code T}.
 */
public final class PointerType extends Type {
    /**
     * The type pointed to.
     */
    public final Type pointee;

    PointerType(Type pointee) {
        this.pointee = pointee;
    }

    @Override
    public String getDialect() {
        return Types.LLVM;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PointerType && ((PointerType) o).pointee.equals(pointee);
    }

    @Override
    public int hashCode() {
        return 13 * pointee.hashCode() + 5;
    }

    @Override
    public String toString() {
        return "!llvm.ptr<" + pointee + ">";
    }
}
