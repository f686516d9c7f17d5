package db.median.query;

/**
 * One entry of a SELECT list: a plain column, '*', or an aggregate call.
 */
public record SelectItem(String column, AggregateCall aggregate) {
    public static SelectItem column(String name) { return new SelectItem(name, null); }
    public static SelectItem star() { return new SelectItem("*", null); }
    public static SelectItem aggregate(AggregateCall call) { return new SelectItem(null, call); }

    public boolean isAggregate() { return aggregate != null; }
    public boolean isStar() { return "*".equals(column); }
}
