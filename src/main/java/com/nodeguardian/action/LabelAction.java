package com.nodeguardian.action;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Upserts labels on the node. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabelAction implements NodeAction {

    private Map<String, String> labels;

    @Override
    public void execute(ActionContext context) {
        if (labels == null || labels.isEmpty()) {
            return;
        }
        context.nodeControl().label(context.nodeName(), labels);
    }

    @Override
    public String getTypeName() {
        return "label";
    }
}
