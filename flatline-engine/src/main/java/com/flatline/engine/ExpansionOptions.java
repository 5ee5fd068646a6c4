package com.flatline.engine;

import com.flatline.compiler.formatter.FormatConfig;

/**
 * 展开选项
 */
public class ExpansionOptions {

    private boolean stripTemplates = true;
    private int indentSize = 4;

    public ExpansionOptions() {
    }

    /** 输出中是否移除待展开单元自身声明的模板（默认移除） */
    public boolean isStripTemplates() {
        return stripTemplates;
    }

    public ExpansionOptions setStripTemplates(boolean stripTemplates) {
        this.stripTemplates = stripTemplates;
        return this;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public ExpansionOptions setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0, got " + indentSize);
        }
        this.indentSize = indentSize;
        return this;
    }

    public FormatConfig toFormatConfig() {
        FormatConfig config = new FormatConfig();
        config.setIndentSize(indentSize);
        return config;
    }
}
