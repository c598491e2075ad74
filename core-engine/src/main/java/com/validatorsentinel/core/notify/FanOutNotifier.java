package com.validatorsentinel.core.notify;

import com.validatorsentinel.core.model.AlertPreference;
import com.validatorsentinel.core.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routes each notification to every registered channel whose
 * {@link AlertPreference} accepts its severity.
 *
 * <p>
 * A failing channel is logged and skipped; the remaining channels still
 * receive the notification.
 * </p>
 *
 * @since 1.0.0
 */
public class FanOutNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(FanOutNotifier.class);

    private final List<Channel> channels = new CopyOnWriteArrayList<>();

    /**
     * Register a delivery channel.
     *
     * @param name       channel name used in logs
     * @param preference severities the channel wants
     * @param delegate   the channel
     * @return this notifier
     */
    public FanOutNotifier register(String name, AlertPreference preference, Notifier delegate) {
        channels.add(new Channel(
                Objects.requireNonNull(name, "name must not be null"),
                Objects.requireNonNull(preference, "AlertPreference must not be null"),
                Objects.requireNonNull(delegate, "Notifier must not be null")));
        LOG.info("Registered notification channel '{}' ({})", name, preference);
        return this;
    }

    @Override
    public void send(Notification notification) {
        deliver(notification);
    }

    /**
     * @param notification the notification
     * @return number of channels that accepted and received it
     */
    public int deliver(Notification notification) {
        Objects.requireNonNull(notification, "Notification must not be null");
        int delivered = 0;
        for (Channel channel : channels) {
            if (!channel.preference.accepts(notification.getSeverity())) {
                LOG.trace("Channel '{}' ignores {} notifications", channel.name, notification.getSeverity());
                continue;
            }
            try {
                channel.delegate.send(notification);
                delivered++;
            } catch (RuntimeException e) {
                LOG.error("Channel '{}' failed to deliver: {}", channel.name, notification.summary(), e);
            }
        }
        return delivered;
    }

    public int channelCount() {
        return channels.size();
    }

    private static final class Channel {
        private final String name;
        private final AlertPreference preference;
        private final Notifier delegate;

        private Channel(String name, AlertPreference preference, Notifier delegate) {
            this.name = name;
            this.preference = preference;
            this.delegate = delegate;
        }
    }
}
