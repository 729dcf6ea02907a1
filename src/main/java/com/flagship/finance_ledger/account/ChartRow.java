package com.flagship.finance_ledger.account;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A candidate (name, type) row from an external chart of accounts source.
 * Fields are raw text and may be missing; {@link AccountService#importChart} validates them.
 */
@Value
public class ChartRow {

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    String type;

    @JsonCreator
    public ChartRow(@JsonProperty("name") String name, @JsonProperty("type") String type) {
        this.name = name;
        this.type = type;
    }

    public static ChartRow of(String name, String type) {
        return new ChartRow(name, type);
    }
}
