package de.ovgu.commitminer.vcs;

/**
 * One entry of the diff between two commits.
 */
public final class ChangedPath {
    public enum ChangeType {
        ADD, MODIFY, DELETE, RENAME, COPY;

        /**
         * @return <code>true</code> if the new side of such a change holds content that has not been seen at this path
         * before
         */
        public boolean producesNewContent() {
            return this != DELETE;
        }
    }

    /**
     * Path used by git for the missing side of an addition or deletion
     */
    public static final String DEV_NULL = "/dev/null";

    private final ChangeType changeType;
    private final String oldPath;
    private final String newPath;

    public ChangedPath(ChangeType changeType, String oldPath, String newPath) {
        this.changeType = changeType;
        this.oldPath = oldPath;
        this.newPath = newPath;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public String getOldPath() {
        return oldPath;
    }

    public String getNewPath() {
        return newPath;
    }

    @Override
    public String toString() {
        switch (changeType) {
            case ADD:
                return "A " + newPath;
            case DELETE:
                return "D " + oldPath;
            case MODIFY:
                return "M " + newPath;
            default:
                return changeType.name().charAt(0) + " " + oldPath + " -> " + newPath;
        }
    }
}
