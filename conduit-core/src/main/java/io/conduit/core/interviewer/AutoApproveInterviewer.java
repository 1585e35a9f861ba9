package io.conduit.core.interviewer;

/// Approves every question without human involvement.
///
/// Yes/no and confirmation questions are answered YES, multiple-choice
/// questions pick the first option, and anything else gets the text `approved`.
public final class AutoApproveInterviewer implements Interviewer {

    public static final String APPROVED = "approved";

    @Override
    public Answer ask(Question question) {
        if (question.type() == QuestionType.YES_NO
                || question.type() == QuestionType.CONFIRMATION) {
            return Answer.yes();
        }
        if (question.type() == QuestionType.MULTIPLE_CHOICE && !question.options().isEmpty()) {
            return Answer.option(question.options().get(0));
        }
        return Answer.text(APPROVED);
    }
}
