import org.junit.jupiter.api.Test;

import com.zen.script.runtime.Coercion;
import com.zen.script.runtime.Conversion;
import com.zen.script.runtime.DeclaredType;
import com.zen.script.runtime.Operations;
import com.zen.script.runtime.RuntimeError;
import com.zen.script.runtime.TypeError;
import com.zen.script.runtime.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ZenScriptValueTest {

    private static final List<Value> NUMBERS = Arrays.asList(
            Value.int32(1), Value.float32(1.5f), Value.int64(2L), Value.float64(2.5));

    @Test
    void highestNumericType_isCommutative() {
        for (Value a : NUMBERS) {
            for (Value b : NUMBERS) {
                assertEquals(Coercion.highestNumericType(a, b), Coercion.highestNumericType(b, a),
                        a.type + " vs " + b.type);
            }
        }
    }

    @Test
    void highestNumericType_followsRank() {
        assertEquals(Value.Type.FLOAT32, Coercion.highestNumericType(Value.int32(1), Value.float32(1f)));
        assertEquals(Value.Type.INT64, Coercion.highestNumericType(Value.float32(1f), Value.int64(1L)));
        assertEquals(Value.Type.FLOAT64, Coercion.highestNumericType(Value.int64(1L), Value.float64(1.0)));

        assertThrows(TypeError.class, () -> Coercion.highestNumericType(Value.string("1"), Value.int64(1L)));
    }

    @Test
    void coerceForOperation_rejectsMismatchedOperands() {
        TypeError concat = assertThrows(TypeError.class,
                () -> Coercion.coerceForOperation(Value.string("a"), Value.int64(1L), "+"));
        assertEquals("Type error: cannot concatenate string and int64", concat.getMessage());
        assertEquals("cannot concatenate string and int64", concat.getDetail());

        TypeError compare = assertThrows(TypeError.class,
                () -> Coercion.coerceForOperation(Value.string("a"), Value.int64(1L), "<"));
        assertEquals("Type error: cannot compare string and int64", compare.getMessage());

        TypeError logic = assertThrows(TypeError.class,
                () -> Coercion.coerceForOperation(Value.int64(1L), Value.bool(true), "and"));
        assertEquals("Type error: logical operators require boolean operands, got int64 and bool",
                logic.getMessage());
    }

    @Test
    void coerceForOperation_widensBothSides() {
        Value[] pair = Coercion.coerceForOperation(Value.int32(3), Value.float64(0.5), "*");
        assertEquals(Value.float64(3.0), pair[0]);
        assertEquals(Value.float64(0.5), pair[1]);
    }

    @Test
    void operations_integerDivisionTruncates() {
        assertEquals(Value.int64(3), Operations.binary("/", Value.int64(7), Value.int64(2)));
        assertEquals(Value.float64(3.5), Operations.binary("/", Value.float64(7), Value.float64(2)));
        assertEquals(Value.string("ab"), Operations.binary("+", Value.string("a"), Value.string("b")));
        assertEquals(Value.bool(true), Operations.binary("<", Value.string("apple"), Value.string("banana")));
    }

    @Test
    void operations_divisionByZero() {
        RuntimeError e = assertThrows(RuntimeError.class,
                () -> Operations.binary("/", Value.int64(1), Value.int64(0)));
        assertEquals("division by zero", e.getMessage());
    }

    @Test
    void operations_unary() {
        assertEquals(Value.int32(-4), Operations.unary("-", Value.int32(4)));
        assertEquals(Value.bool(false), Operations.unary("not", Value.bool(true)));
        assertThrows(TypeError.class, () -> Operations.unary("-", Value.string("x")));
    }

    @Test
    void conversion_narrowingIsRangeChecked() {
        assertEquals(Value.int32(42), Conversion.convert(Value.int64(42), Value.Type.INT32));

        TypeError e = assertThrows(TypeError.class,
                () -> Conversion.convert(Value.int64(3_000_000_000L), Value.Type.INT32));
        assertEquals("Type error: int64 value 3000000000 out of range for int32", e.getMessage());

        assertThrows(TypeError.class, () -> Conversion.convert(Value.float64(1e300), Value.Type.FLOAT32));
        assertEquals(Value.int64(3), Conversion.convert(Value.float64(3.9), Value.Type.INT64));
    }

    @Test
    void conversion_fromStrings() {
        assertEquals(Value.int64(12), Conversion.convert(Value.string("12"), Value.Type.INT64));
        assertEquals(Value.float64(2.5), Conversion.convert(Value.string("2.5"), Value.Type.FLOAT64));
        assertEquals(Value.int32(7), Conversion.convert(Value.string(" 7 "), Value.Type.INT32));
        assertEquals(Value.bool(true), Conversion.convert(Value.string("true"), Value.Type.BOOL));
        assertEquals(Value.bool(false), Conversion.convert(Value.string("0"), Value.Type.BOOL));

        TypeError e = assertThrows(TypeError.class,
                () -> Conversion.convert(Value.string("abc"), Value.Type.INT32));
        assertEquals("Type error: cannot convert string 'abc' to int", e.getMessage());

        assertThrows(TypeError.class, () -> Conversion.convert(Value.string("maybe"), Value.Type.BOOL));
    }

    @Test
    void conversion_nullBecomesZeroValue() {
        assertEquals(Value.int64(0), Conversion.convert(Value.nil(), Value.Type.INT64));
        assertEquals(Value.bool(false), Conversion.convert(Value.nil(), Value.Type.BOOL));
        assertEquals(Value.string("null"), Conversion.convert(Value.nil(), Value.Type.STRING));
    }

    @Test
    void conversion_float32ToFloat64KeepsDecimalForm() {
        assertEquals(Value.float64(0.1), Conversion.convert(Value.float32(0.1f), Value.Type.FLOAT64));
    }

    @Test
    void declaredType_enforcesKnownNames() {
        DeclaredType intType = DeclaredType.named("int");
        assertTrue(intType.isChecked());
        assertEquals(Value.int32(5), intType.coerce(Value.int64(5)));
        assertEquals(Value.nil(), intType.coerce(Value.nil()));
        assertThrows(TypeError.class, () -> intType.coerce(Value.string("5")));

        DeclaredType custom = DeclaredType.named("Point");
        assertFalse(custom.isChecked());
        assertEquals(Value.string("anything"), custom.coerce(Value.string("anything")));
    }

    @Test
    void truthiness() {
        assertFalse(Value.int64(0).isTruthy());
        assertTrue(Value.int32(-1).isTruthy());
        assertFalse(Value.float64(0.0).isTruthy());
        assertTrue(Value.float32(0.5f).isTruthy());
        assertFalse(Value.string("").isTruthy());
        assertTrue(Value.string("x").isTruthy());
        assertFalse(Value.nil().isTruthy());
        assertFalse(Value.array(null).isTruthy());
        assertFalse(Value.map(null).isTruthy());
    }

    @Test
    void valueEquals_comparesTagAndPayload() {
        assertEquals(Value.int64(1), Value.int64(1));
        assertNotEquals(Value.int32(1), Value.int64(1));
        assertEquals(Value.nil(), Value.nil());
        assertNotEquals(Value.nil(), Value.int64(0));
    }

    private static Value eq(Value left, Value right) {
        Value[] operands = Coercion.coerceForOperation(left, right, "==");
        return Operations.binary("==", operands[0], operands[1]);
    }

    @Test
    void equalityOperator_coercesToSameType() {
        assertEquals(Value.bool(true), eq(Value.int32(1), Value.int64(1)));
        assertEquals(Value.bool(true), eq(Value.int64(1), Value.string("1")));
        assertEquals(Value.bool(true), eq(Value.string("true"), Value.bool(true)));
        assertEquals(Value.bool(false), eq(Value.string("x"), Value.float64(1.5)));
        assertEquals(Value.bool(false), eq(Value.nil(), Value.int64(0)));
        assertEquals(Value.bool(true), eq(Value.nil(), Value.nil()));

        TypeError e = assertThrows(TypeError.class, () -> eq(Value.bool(true), Value.int64(1)));
        assertEquals("Type error: cannot coerce bool and int64 to same type", e.getMessage());
    }

    @Test
    void equalityOperator_comparesFloatsAsPrimitives() {
        assertEquals(Value.bool(true), eq(Value.float64(0.0), Value.float64(-0.0)));
        assertEquals(Value.bool(true), eq(Value.float32(0f), Value.float32(-0f)));
        assertEquals(Value.bool(false), eq(Value.float64(Double.NaN), Value.float64(Double.NaN)));

        Value nested = Value.array(new ArrayList<>(Arrays.asList(Value.float64(-0.0))));
        Value other = Value.array(new ArrayList<>(Arrays.asList(Value.float64(0.0))));
        assertEquals(Value.bool(true), eq(nested, other));
    }

    @Test
    void rendering() {
        assertEquals("2", Value.float64(2.0).toString());
        assertEquals("3.14", Value.float64(3.14).toString());
        assertEquals("0.5", Value.float32(0.5f).toString());
        assertEquals("-7", Value.int64(-7).toString());
        assertEquals("null", Value.nil().toString());
        assertEquals("plain", Value.string("plain").toString());

        Map<String, Value> m = new LinkedHashMap<>();
        m.put("k", Value.string("v"));
        m.put("n", Value.array(new ArrayList<>(Arrays.asList(Value.int64(1), Value.string("a")))));
        assertEquals("{k: \"v\", n: [1, \"a\"]}", Value.map(m).toString());
    }

    @Test
    void copy_isDeepForContainers() {
        List<Value> inner = new ArrayList<>(Arrays.asList(Value.int64(1)));
        Value outer = Value.array(new ArrayList<>(Arrays.asList(Value.array(inner))));

        Value copy = outer.copy();
        copy.asArray().get(0).asArray().add(Value.int64(2));

        assertEquals(1, inner.size());
        assertEquals(2, copy.asArray().get(0).asArray().size());
    }

    @Test
    void accessors_checkTag() {
        TypeError e = assertThrows(TypeError.class, () -> Value.string("x").asInt64());
        assertEquals("Type error: expected int64, got string", e.getMessage());

        TypeError call = assertThrows(TypeError.class, () -> Value.int64(1).asCallable());
        assertEquals("Type error: Cannot call value of type int64", call.getMessage());
    }
}
