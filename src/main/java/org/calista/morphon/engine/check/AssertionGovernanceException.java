package org.calista.morphon.engine.check;

import org.calista.morphon.engine.core.InvalidInputException;

/** A protected (tier 0/1) assertion was about to be replaced without an explicit supersession. */
public final class AssertionGovernanceException extends InvalidInputException {

    private final String assertionId;

    public AssertionGovernanceException(String source, String assertionId, String message) {
        super(source, message);
        this.assertionId = assertionId;
    }

    public String assertionId() { return assertionId; }
}
