package com.huntflow.statement;

import com.huntflow.pattern.CenteredPattern;

/**
 * Statement that may carry a WHERE pattern
 */
public interface PatternStatement {

    CenteredPattern getWhere();

    void setWhere(CenteredPattern where);
}
