package com.nodeguardian.action;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Removes label keys from the node. Missing keys are not an error. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoveLabelAction implements NodeAction {

    private List<String> labels;

    @Override
    public void execute(ActionContext context) {
        if (labels == null || labels.isEmpty()) {
            return;
        }
        context.nodeControl().removeLabels(context.nodeName(), labels);
    }

    @Override
    public String getTypeName() {
        return "removeLabel";
    }
}
