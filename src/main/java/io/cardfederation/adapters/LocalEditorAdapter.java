package io.cardfederation.adapters;

import io.cardfederation.catalog.LocalCardCatalog;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.models.AdapterCard;
import io.cardfederation.models.RemoteCardEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Adapter for this instance. Always available; reads and writes the local catalog.
 */
public class LocalEditorAdapter implements PlatformAdapter {

    private final LocalCardCatalog catalog;

    public LocalEditorAdapter(LocalCardCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public PlatformId getPlatform() {
        return PlatformId.EDITOR;
    }

    @Override
    public String getDisplayName() {
        return PlatformId.EDITOR.getDisplayName();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String pushCard(AdapterCard card, String existingRemoteId) {
        return catalog.saveCard(card.getCard(), existingRemoteId);
    }

    @Override
    public AdapterCard pullCard(String remoteId) {
        return catalog.getCard(remoteId)
                .orElseThrow(() -> new AdapterCallException(PlatformId.EDITOR, FailureKind.CLIENT_ERROR, 404,
                        "Local card " + remoteId + " not found", null));
    }

    @Override
    public List<RemoteCardEntry> listCards() {
        return catalog.listCards().stream()
                .map(card -> new RemoteCardEntry(card.getId(), card.getName()))
                .collect(Collectors.toList());
    }
}
