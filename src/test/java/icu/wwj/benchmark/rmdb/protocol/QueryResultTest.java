package icu.wwj.benchmark.rmdb.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.grid;
import static icu.wwj.benchmark.rmdb.protocol.ScriptedTransport.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryResultTest {
    
    private static QueryResult fiveRows() {
        return ResponseParser.parse(grid(row("i_id", "i_name"), row(1, "a"), row(2, "b"), row(3, "c"), row(4, "d"), row(5, "e")));
    }
    
    @Test
    void assertFetchIsOneShotAndOrdered() {
        QueryResult actual = fiveRows();
        assertEquals("1", actual.fetchOne().getString(0));
        List<Row> many = actual.fetchMany(2);
        assertEquals(2, many.size());
        assertEquals("b", many.get(0).getString("i_name"));
        assertEquals("c", many.get(1).getString("i_name"));
        List<Row> rest = actual.fetchAll();
        assertEquals(2, rest.size());
        assertEquals(5, rest.get(1).getInteger(0));
        assertFalse(actual.hasNext());
        assertNull(actual.fetchOne());
        assertTrue(actual.fetchMany(3).isEmpty());
        assertTrue(actual.fetchAll().isEmpty());
        assertEquals(5, actual.getRowCount());
    }
    
    @Test
    void assertFetchManyBeyondBuffered() {
        assertEquals(5, fiveRows().fetchMany(10).size());
    }
    
    @Test
    void assertNumericConversionByColumnName() {
        Row row = ResponseParser.parse(grid(row("s_quantity", "i_price"), row("3000", "12.50"))).fetchOne();
        assertEquals(3000, row.getInteger("s_quantity"));
        assertEquals(3000L, row.getLong(0));
        assertEquals(12.5, row.getDouble("i_price"), 1e-9);
        assertThrows(ArithmeticException.class, () -> row.getInteger("i_price"));
    }
    
    @Test
    void assertUnknownColumn() {
        Row row = fiveRows().fetchOne();
        assertThrows(IllegalArgumentException.class, () -> row.getString("i_price"));
    }
}
