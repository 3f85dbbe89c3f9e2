package com.vedant.securequery.service;

/**
 * Supplies a replacement statement after a failed execution, typically from an external
 * repair step. Returning null or blank ends the retry sequence.
 */
@FunctionalInterface
public interface SqlCorrector {

    SqlCorrector SAME_STATEMENT = (failedSql, errorMessage, attemptNumber) -> failedSql;

    String correct(String failedSql, String errorMessage, int attemptNumber);
}
