package db.median.agg;

import db.median.catalog.DataType;

// Static type and collation of an aggregate argument, as the engine knows them at call time.
// collation: only used for VARCHAR, null means the C collation.
public record ArgType(DataType type, String collation) {
    public static ArgType of(DataType type) { return new ArgType(type, null); }
}
