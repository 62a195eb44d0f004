package com.evoila.argus.common.query.model;

/** The query builder's only output: SQL text plus the parameters bound to its placeholders. */
public record BuiltQuery(String query, QueryParams parameters) {}
