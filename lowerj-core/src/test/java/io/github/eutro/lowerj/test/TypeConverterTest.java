package io.github.eutro.lowerj.test;

import io.github.eutro.lowerj.conversion.AsyncRuntimeTypeConverter;
import io.github.eutro.lowerj.conversion.LowLevelTypeConverter;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TypeConverterTest {
    @Test
    void testLastRegisteredFirst() {
        TypeConverter tc = new TypeConverter()
                .addConversion(t -> t.equals(Types.I32) ? Optional.of(Types.I64) : null)
                .addConversion(t -> t.equals(Types.I32) ? Optional.of(Types.I8) : null);
        assertEquals(Optional.of(Types.I8), tc.convertType(Types.I32));
    }

    @Test
    void testFallThrough() {
        TypeConverter tc = new TypeConverter()
                .addConversion(t -> t.equals(Types.I32) ? Optional.of(Types.I64) : null)
                .addConversion(t -> t.equals(Types.I1) ? Optional.of(Types.I8) : null);
        assertEquals(Optional.of(Types.I64), tc.convertType(Types.I32));
        assertEquals(Optional.of(Types.I8), tc.convertType(Types.I1));
        assertEquals(Optional.empty(), tc.convertType(Types.F32));
    }

    @Test
    void testMatchedFailureStopsFallThrough() {
        TypeConverter tc = new TypeConverter()
                .addIdentityConversion()
                .addConversion(t -> t.equals(Types.INDEX) ? Optional.empty() : null);
        assertEquals(Optional.empty(), tc.convertType(Types.INDEX));
        assertTrue(tc.isLegal(Types.I32));
        assertFalse(tc.isLegal(Types.INDEX));
    }

    @Test
    void testInnerConverter() {
        TypeConverter inner = new TypeConverter()
                .addConversion(t -> t.equals(Types.I32) ? Optional.of(Types.I64) : null);
        TypeConverter outer = new TypeConverter(inner)
                .addConversion(t -> t.equals(Types.I1) ? Optional.of(Types.I8) : null);
        assertEquals(Optional.of(Types.I64), outer.convertType(Types.I32));
        assertEquals(Optional.of(Types.I8), outer.convertType(Types.I1));
        assertEquals(Optional.empty(), inner.convertType(Types.I1));
    }

    @Test
    void testMemoised() {
        AtomicInteger calls = new AtomicInteger();
        TypeConverter tc = new TypeConverter().addConversion(t -> {
            calls.incrementAndGet();
            return Optional.of(t);
        });
        tc.convertType(Types.I32);
        tc.convertType(Types.I32);
        assertEquals(1, calls.get());
    }

    @Test
    void testSignature() {
        TypeConverter tc = new AsyncRuntimeTypeConverter();
        assertEquals(
                Optional.of(Types.function(Arrays.asList(Types.OPAQUE_PTR, Types.I32), Arrays.asList(Types.LLVM_TOKEN))),
                tc.convertSignature(Types.function(
                        Arrays.asList(Types.asyncValue(Types.I64), Types.I32),
                        Arrays.asList(Types.CORO_STATE))));

        TypeConverter partial = new TypeConverter()
                .addConversion(t -> t.equals(Types.I32) ? Optional.of(t) : null);
        assertTrue(partial.convertSignature(Types.function(Types.I32, Types.I32)).isPresent());
        assertTrue(partial.convertSignature(Types.function(Types.I32, Types.I64)).isEmpty());
        assertTrue(partial.convertSignature(Types.function(Types.I64, Types.I32)).isEmpty());
    }

    @Test
    void testAsyncRuntimeTypes() {
        TypeConverter tc = new AsyncRuntimeTypeConverter();
        for (Type type : new Type[]{
                Types.ASYNC_TOKEN,
                Types.ASYNC_GROUP,
                Types.asyncValue(Types.I64),
                Types.asyncValue(Types.asyncValue(Types.F32)),
                Types.CORO_HANDLE,
        }) {
            assertEquals(Optional.of(Types.OPAQUE_PTR), tc.convertType(type), type::toString);
        }
        assertEquals(Optional.of(Types.LLVM_TOKEN), tc.convertType(Types.CORO_ID));
        assertEquals(Optional.of(Types.LLVM_TOKEN), tc.convertType(Types.CORO_STATE));
        assertEquals(Optional.of(Types.INDEX), tc.convertType(Types.INDEX));
        assertTrue(tc.isLegal(Types.OPAQUE_PTR));
        assertFalse(tc.isLegal(Types.ASYNC_TOKEN));
    }

    @Test
    void testLayeredPayloadConverter() {
        TypeConverter low = new LowLevelTypeConverter();
        assertEquals(Optional.of(Types.I64), low.convertType(Types.INDEX));
        assertEquals(Optional.of(Types.pointer(Types.I64)), low.convertType(Types.pointer(Types.INDEX)));
        assertEquals(Optional.empty(), low.convertType(Types.ASYNC_TOKEN));

        TypeConverter payload = new TypeConverter(low)
                .addConversion(AsyncRuntimeTypeConverter::convertAsyncTypes);
        assertEquals(Optional.of(Types.OPAQUE_PTR), payload.convertType(Types.ASYNC_TOKEN));
        assertEquals(Optional.of(Types.I64), payload.convertType(Types.INDEX));
        assertEquals(Optional.of(Types.F64), payload.convertType(Types.F64));
    }

    @Test
    void testNestedTypesSeeOuterRules() {
        TypeConverter low = new LowLevelTypeConverter();
        TypeConverter payload = new TypeConverter(low)
                .addConversion(AsyncRuntimeTypeConverter::convertAsyncTypes);
        assertSame(payload, low.outermost());
        assertEquals(Optional.of(Types.pointer(Types.OPAQUE_PTR)),
                payload.convertType(Types.pointer(Types.ASYNC_TOKEN)));
        assertEquals(Optional.of(Types.function(Types.LLVM_TOKEN, Types.OPAQUE_PTR, Types.I64)),
                payload.convertType(Types.function(Types.CORO_ID, Types.asyncValue(Types.I32), Types.INDEX)));
    }

    @Test
    void testInnerRuleInvalidatesOuterCache() {
        TypeConverter inner = new TypeConverter();
        TypeConverter outer = new TypeConverter(inner);
        assertEquals(Optional.empty(), outer.convertType(Types.I32));
        inner.addConversion(t -> t.equals(Types.I32) ? Optional.of(Types.I64) : null);
        assertEquals(Optional.of(Types.I64), outer.convertType(Types.I32));
    }

    @Test
    void testWrappedOnlyOnce() {
        TypeConverter inner = new TypeConverter();
        new TypeConverter(inner);
        assertThrows(IllegalStateException.class, () -> new TypeConverter(inner));
    }
}
