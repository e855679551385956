package com.pagewright.core.error;

import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.rep.Representation;

/**
 * Raised when a fixed snapshot is requested that was never declared as final.
 */
public class NoSuchSnapshotException extends CompilationException {

    private final SnapshotName snapshotName;

    public NoSuchSnapshotException(Representation rep, SnapshotName snapshotName) {
        super("The " + rep.reference() + " representation does not have a snapshot " + snapshotName + ".");
        this.snapshotName = snapshotName;
    }

    public SnapshotName getSnapshotName() {
        return snapshotName;
    }
}
