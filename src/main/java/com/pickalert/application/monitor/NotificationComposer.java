package com.pickalert.application.monitor;

import com.pickalert.domain.model.NextPickProjection;
import com.pickalert.domain.model.OnTheClock;
import com.pickalert.domain.model.PickNotification;
import com.pickalert.domain.model.PlayerDescriptor;
import com.pickalert.domain.model.ResolvedPick;
import com.pickalert.domain.ports.NameResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * Builds the content of a pick alert.
 * Unresolvable user ids are shown as-is rather than failing the alert.
 */
@Component
public class NotificationComposer {

    private static final Logger logger = LoggerFactory.getLogger(NotificationComposer.class);

    private final NameResolver nameResolver;

    public NotificationComposer(NameResolver nameResolver) {
        this.nameResolver = nameResolver;
    }

    /**
     * Composes the alert for a resolved pick.
     *
     * @param resolvedPick The pick and its place in the order
     * @param projection Who picks next, or null when a later pick of the same batch follows
     * @param mentionNextPicker Whether the next picker should be pinged rather than just named
     */
    public PickNotification compose(ResolvedPick resolvedPick, NextPickProjection projection, boolean mentionNextPicker) {
        PlayerDescriptor player = resolvedPick.pick().player();
        String playerName = player.fullName();
        String pickedByLabel = displayName(resolvedPick.pick().pickedBy());
        OnTheClock onTheClock = onTheClock(projection, mentionNextPicker);

        StringBuilder summary = new StringBuilder()
            .append("Pick ").append(resolvedPick.globalIndex()).append(": ")
            .append(playerName).append(" was selected.");
        if (onTheClock.kind() == OnTheClock.Kind.PROJECTED) {
            summary.append(' ').append(onTheClock.label()).append(" is on the clock.");
        } else if (onTheClock.kind() == OnTheClock.Kind.DRAFT_COMPLETE) {
            summary.append(' ').append(onTheClock.label());
        }

        return new PickNotification(
            summary.toString(),
            resolvedPick.globalIndex(),
            resolvedPick.round(),
            resolvedPick.slotInRound(),
            playerName,
            player.position(),
            player.team(),
            pickedByLabel,
            onTheClock
        );
    }

    private OnTheClock onTheClock(NextPickProjection projection, boolean mention) {
        if (projection == null) {
            return OnTheClock.none();
        }
        if (projection.draftComplete()) {
            return OnTheClock.draftComplete();
        }
        String label = projection.owner()
            .map(ownerId -> mention ? mentionOf(ownerId) : displayName(ownerId))
            .orElse("Slot " + projection.slot().teamIndex());
        return OnTheClock.projected(label);
    }

    private String displayName(String externalId) {
        return lookup(externalId, nameResolver::resolve);
    }

    private String mentionOf(String externalId) {
        return lookup(externalId, nameResolver::resolveMention);
    }

    private String lookup(String externalId, Function<String, Optional<String>> resolver) {
        try {
            Optional<String> resolved = resolver.apply(externalId);
            if (resolved != null && resolved.isPresent() && !resolved.get().isBlank()) {
                return resolved.get();
            }
        } catch (RuntimeException e) {
            logger.warn("Could not resolve name for user {}: {}", externalId, e.getMessage());
        }
        return externalId;
    }
}
