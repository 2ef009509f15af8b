package dev.yeying.interviewer.exception;

public class DepthLimitExceededException extends ResumeTreeException {

    private final int maxDepth;

    public DepthLimitExceededException(Long parentId, int maxDepth) {
        super(ResumeTreeErrorKind.DEPTH_LIMIT_EXCEEDED,
                "Resume " + parentId + " cannot be forked: a tree holds at most " + maxDepth + " levels");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
