package io.cardfederation.adapters;

import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.models.AdapterCard;
import io.cardfederation.models.RemoteCardEntry;

import java.util.List;

/**
 * Uniform push/pull surface over one platform's card API.
 *
 * <p>Every remote call may throw {@link AdapterCallException}; implementations classify
 * the failure and never retry on their own.
 */
public interface PlatformAdapter {

    PlatformId getPlatform();

    String getDisplayName();

    /**
     * Probe the platform. Transport failures propagate; a reachable platform that refuses the
     * probe answers false.
     */
    boolean isAvailable() throws AdapterCallException;

    /**
     * Write a card to the platform.
     *
     * @param card card to write
     * @param existingRemoteId id of the card on this platform from a previous sync, or null to create
     * @return id of the card on this platform
     */
    String pushCard(AdapterCard card, String existingRemoteId) throws AdapterCallException;

    /**
     * Read one card. A card that does not exist fails with {@code CLIENT_ERROR}.
     */
    AdapterCard pullCard(String remoteId) throws AdapterCallException;

    /**
     * Outbox listing of the platform.
     */
    List<RemoteCardEntry> listCards() throws AdapterCallException;

    /**
     * True for the adapter that writes into this instance's own catalog.
     */
    default boolean isLocal() {
        return getPlatform().isLocal();
    }
}
