package com.nodeguardian.domain.model;

/** Composite key of all per-(rule, node) bookkeeping. */
public record NodeRuleKey(String ruleId, String nodeName) {

    @Override
    public String toString() {
        return ruleId + "/" + nodeName;
    }
}
