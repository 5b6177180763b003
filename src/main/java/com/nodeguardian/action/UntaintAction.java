package com.nodeguardian.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Removes every taint with the given key from the node. Idempotent. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UntaintAction implements NodeAction {

    private String key;

    @Override
    public void execute(ActionContext context) {
        context.nodeControl().untaint(context.nodeName(), effectiveKey());
    }

    public String effectiveKey() {
        return key != null && !key.isBlank() ? key : TaintAction.DEFAULT_KEY;
    }

    @Override
    public String getTypeName() {
        return "untaint";
    }
}
