package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One delivery attempt of an alert for an {@link Anomaly} to a notification
 * channel. Written by the delivery layer.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private UUID channelId;
    private String channelName;
    private Instant sentAt;
    private boolean success;
    private String error;

    /** No-arg constructor required by Jackson. */
    public AlertRecord() {
    }

    public AlertRecord(UUID channelId, String channelName, Instant sentAt, boolean success, String error) {
        this.channelId = channelId;
        this.channelName = channelName;
        this.sentAt = sentAt;
        this.success = success;
        this.error = error;
    }

    public UUID getChannelId() {
        return channelId;
    }

    public void setChannelId(UUID channelId) {
        this.channelId = channelId;
    }

    public String getChannelName() {
        return channelName;
    }

    public void setChannelName(String channelName) {
        this.channelName = channelName;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public void setSentAt(Instant sentAt) {
        this.sentAt = sentAt;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return "AlertRecord{" +
                "channelId=" + channelId +
                ", channelName='" + channelName + '\'' +
                ", sentAt=" + sentAt +
                ", success=" + success +
                ", error='" + error + '\'' +
                '}';
    }
}
