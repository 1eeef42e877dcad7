package com.e2eq.twins.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of query results. {@code continuationToken} is null on the last page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryPage {
    private List<JsonNode> items;
    private String continuationToken;
    private double queryCharge;
}
