import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import io.github.flameyossnowy.linkage.api.meta.ValueConverter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValueConverterTest {
    enum Tier { FREE, PRO }

    @Test
    void integral_values_in_range_are_narrowed() {
        assertEquals(7, ValueConverter.fromDbValue(7L, Integer.class));
        assertEquals((short) 3, ValueConverter.fromDbValue(new BigDecimal("3"), Short.class));
        assertEquals(Long.MAX_VALUE, ValueConverter.fromDbValue(BigInteger.valueOf(Long.MAX_VALUE), Long.class));
        assertEquals(7, ValueConverter.fromDbValue(7.9d, Integer.class));
        assertEquals(12, ValueConverter.fromDbValue("12", Integer.class));
    }

    @Test
    void integral_values_out_of_range_are_rejected() {
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(3_000_000_000L, Integer.class));
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(BigInteger.valueOf(Integer.MAX_VALUE).add(BigInteger.ONE), Integer.class));
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(40_000, Short.class));
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(new BigDecimal("1e30"), Long.class));
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(Double.NaN, Long.class));
    }

    @Test
    void enum_ordinals_are_bounds_checked() {
        assertEquals(Tier.PRO, ValueConverter.fromDbValue(1, Tier.class));
        assertEquals(Tier.FREE, ValueConverter.fromDbValue("FREE", Tier.class));
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(2, Tier.class));
        assertThrows(TypeConversionException.class, () -> ValueConverter.fromDbValue(-1, Tier.class));
    }
}
