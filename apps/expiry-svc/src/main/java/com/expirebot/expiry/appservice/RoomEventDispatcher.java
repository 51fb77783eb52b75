package com.expirebot.expiry.appservice;

import com.expirebot.expiry.command.ExpireCommandHandler;
import com.expirebot.expiry.config.ExpirebotProperties;
import com.expirebot.expiry.lifecycle.RoomLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes pushed room events: the bot's own membership drives room policies, messages and
 * stickers get tracked, and messages starting with the command prefix are run as commands.
 */
@Component
public class RoomEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RoomEventDispatcher.class);

    private final RoomLifecycleService lifecycleService;
    private final ExpireCommandHandler commandHandler;
    private final String botUserId;

    public RoomEventDispatcher(RoomLifecycleService lifecycleService,
                               ExpireCommandHandler commandHandler,
                               ExpirebotProperties properties) {
        this.lifecycleService = lifecycleService;
        this.commandHandler = commandHandler;
        this.botUserId = properties.homeserver().botUserId();
    }

    public void dispatch(RoomEvent event) {
        if (event.type() == null || event.roomId() == null) {
            log.debug("Ignoring event without type or room: {}", event.eventId());
            return;
        }
        switch (event.type()) {
            case "m.room.member" -> onMembership(event);
            case "m.room.message" -> onMessage(event);
            case "m.sticker" -> lifecycleService.onMessage(event.roomId(), event.eventId(), event.type(), null);
            default -> log.trace("Ignoring {} event {}", event.type(), event.eventId());
        }
    }

    private void onMembership(RoomEvent event) {
        if (!botUserId.equals(event.stateKey())) {
            return;
        }
        String membership = event.contentString("membership");
        if (membership == null) {
            return;
        }
        switch (membership) {
            case "invite" -> lifecycleService.onInvited(event.roomId(), event.sender());
            case "join" -> lifecycleService.onBotJoined(event.roomId());
            case "leave", "ban" -> lifecycleService.onBotLeft(event.roomId());
            default -> log.debug("Ignoring bot membership {} in {}", membership, event.roomId());
        }
    }

    private void onMessage(RoomEvent event) {
        String msgtype = event.contentString("msgtype");
        if (event.eventId() != null) {
            lifecycleService.onMessage(event.roomId(), event.eventId(), event.type(), msgtype);
        }
        if (botUserId.equals(event.sender()) || !"m.text".equals(msgtype)) {
            return;
        }
        String body = event.contentString("body");
        if (commandHandler.isCommand(body)) {
            commandHandler.handle(event.roomId(), event.sender(), body);
        }
    }
}
