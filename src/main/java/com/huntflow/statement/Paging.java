package com.huntflow.statement;

/**
 * LIMIT / OFFSET pair; either side may be absent
 */
public class Paging {
    private static final Paging NONE = new Paging(null, null);

    private final Integer limit;
    private final Integer offset;

    public Paging(Integer limit, Integer offset) {
        this.limit = limit;
        this.offset = offset;
    }

    public static Paging none() {
        return NONE;
    }

    public static Paging of(Integer limit, Integer offset) {
        return limit == null && offset == null ? NONE : new Paging(limit, offset);
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public boolean isEmpty() {
        return limit == null && offset == null;
    }

    @Override
    public String toString() {
        return "LIMIT " + limit + " OFFSET " + offset;
    }
}
