package com.sni.curation.service.exception;

import java.util.UUID;

public class SelfReferenceException extends CurationException {

    public SelfReferenceException(UUID narrativeId) {
        super("SELF_REFERENCE", "Narrative " + narrativeId + " cannot be its own parent");
    }
}
