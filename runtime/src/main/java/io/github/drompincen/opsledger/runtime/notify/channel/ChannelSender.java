package io.github.drompincen.opsledger.runtime.notify.channel;

import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.runtime.error.DeliveryFailureException;
import io.github.drompincen.opsledger.runtime.notify.ChannelMessage;

/**
 * Outbound side of one notification channel.
 */
public interface ChannelSender {

    NotificationChannel channel();

    boolean isConfigured();

    /**
     * Hands the message to the channel. Returning normally means the channel accepted it.
     *
     * @param address the contact's identifier on this channel (email, phone, chat id)
     * @throws DeliveryFailureException when the channel is unconfigured, the address is missing
     *                                  or the remote side refuses the message
     */
    void send(String address, ChannelMessage message);
}
