package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.types.AsyncValueType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Converts asynchronous types to their runtime representation, and leaves every other type alone.
 * <p>
 * Tokens, groups, values and coroutine handles become opaque pointers. Coroutine ids and
 * states become low-level tokens.
 */
public class AsyncRuntimeTypeConverter extends TypeConverter {
    public AsyncRuntimeTypeConverter() {
        addIdentityConversion();
        addConversion(AsyncRuntimeTypeConverter::convertAsyncTypes);
    }

    /**
     * The rule mapping asynchronous types to runtime types, to be layered onto other converters.
     *
     * @param type The type.
     * @return The runtime type, or null if {@code type} is not an asynchronous type.
     */
    public static @Nullable Optional<Type> convertAsyncTypes(Type type) {
        if (type.equals(Types.ASYNC_TOKEN)
                || type.equals(Types.ASYNC_GROUP)
                || type instanceof AsyncValueType
                || type.equals(Types.CORO_HANDLE)) {
            return Optional.of(Types.OPAQUE_PTR);
        }
        if (type.equals(Types.CORO_ID) || type.equals(Types.CORO_STATE)) {
            return Optional.of(Types.LLVM_TOKEN);
        }
        return null;
    }
}
