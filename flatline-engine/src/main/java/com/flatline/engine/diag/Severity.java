package com.flatline.engine.diag;

/**
 * 诊断严重级别
 */
public enum Severity {
    ERROR, WARNING, INFO
}
