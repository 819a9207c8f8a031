package icu.wwj.benchmark.rmdb.protocol;

import java.math.BigDecimal;
import java.util.List;

/**
 * One data row of a result grid. Values arrive as text and are converted on access.
 */
public final class Row {
    
    private final List<String> columnNames;
    
    private final List<String> values;
    
    Row(List<String> columnNames, List<String> values) {
        this.columnNames = columnNames;
        this.values = List.copyOf(values);
    }
    
    public int size() {
        return values.size();
    }
    
    public List<String> getValues() {
        return values;
    }
    
    public String getString(int pos) {
        return values.get(pos);
    }
    
    public String getString(String column) {
        int pos = columnNames.indexOf(column);
        if (pos < 0) {
            throw new IllegalArgumentException("Column `%s` not in %s".formatted(column, columnNames));
        }
        return values.get(pos);
    }
    
    public int getInteger(int pos) {
        return new BigDecimal(getString(pos)).intValueExact();
    }
    
    public int getInteger(String column) {
        return new BigDecimal(getString(column)).intValueExact();
    }
    
    public long getLong(int pos) {
        return new BigDecimal(getString(pos)).longValueExact();
    }
    
    public double getDouble(int pos) {
        return Double.parseDouble(getString(pos));
    }
    
    public double getDouble(String column) {
        return Double.parseDouble(getString(column));
    }
    
    @Override
    public String toString() {
        return values.toString();
    }
}
