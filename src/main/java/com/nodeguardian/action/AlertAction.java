package com.nodeguardian.action;

import com.nodeguardian.exception.ActionExecutionException;
import com.nodeguardian.notification.AlertMessage;
import com.nodeguardian.notification.ChannelConfig;
import com.nodeguardian.notification.DispatchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Renders a template for the batch's node and sends it to the channels. One alert is sent per
 * node; alerts of several nodes are not merged.
 *
 * <p>Without a template name the built-in for the batch kind is used ({@code default} for
 * trigger, {@code recovery} for recovery). The action fails only if no channel could be reached;
 * on a partial delivery the failed channels are passed to the context's notification error sink
 * and the action succeeds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertAction implements NodeAction {

    private String template;
    private List<ChannelConfig> channels;
    private Boolean enabled;

    @Override
    public void execute(ActionContext context) {
        if (enabled != null && !enabled) {
            return;
        }
        AlertMessage message = context.alertDispatcher()
                .render(template, context.rule(), List.of(context.nodeName()), context.alertType(), context.timestamp());
        DispatchResult result = context.alertDispatcher().dispatch(message, channels);
        if (result.getOutcome() == DispatchResult.Outcome.FAILED) {
            throw new ActionExecutionException("Alert not delivered to any channel: " + result.getFailed());
        }
        if (result.getOutcome() == DispatchResult.Outcome.PARTIAL) {
            result.getFailed().forEach((channel, error) -> context.notificationErrors().accept(channel + ": " + error));
        }
    }

    @Override
    public String getTypeName() {
        return "alert";
    }
}
