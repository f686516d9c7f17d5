package db.median.query;

import java.util.Locale;

// function(argColumn [COLLATE collation]) [OVER (...)] [AS alias]
// collation, window and alias may be null.
public record AggregateCall(String function, String argColumn, String collation, WindowSpec window, String alias) {
    public String resultName() {
        return alias != null ? alias : function.toLowerCase(Locale.ROOT);
    }
}
