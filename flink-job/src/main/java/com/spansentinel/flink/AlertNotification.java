package com.spansentinel.flink;

import com.spansentinel.core.model.Alert;

import java.io.Serializable;
import java.util.Objects;

/**
 * An alert together with its rendered message, as published on the alerts
 * topic for notification delivery.
 *
 * @since 1.0.0
 */
public class AlertNotification implements Serializable {

    private static final long serialVersionUID = 1L;

    private Alert alert;
    private String ruleName;
    private String message;

    public AlertNotification() {
    }

    public AlertNotification(Alert alert, String ruleName, String message) {
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.ruleName = ruleName;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public Alert getAlert() {
        return alert;
    }

    public void setAlert(Alert alert) {
        this.alert = alert;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @Override
    public String toString() {
        return "AlertNotification{" +
                "ruleName='" + ruleName + '\'' +
                ", alertId=" + (alert != null ? alert.getId() : null) +
                ", severity=" + (alert != null ? alert.getSeverity() : null) +
                '}';
    }
}
