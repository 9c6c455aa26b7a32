package com.toolflow.oracle;

/**
 * Purpose of a reasoning oracle request.
 */
public enum OracleMode {
    VALIDATE,
    RECTIFY
}
