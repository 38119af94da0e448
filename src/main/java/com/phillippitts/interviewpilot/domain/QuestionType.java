package com.phillippitts.interviewpilot.domain;

/**
 * Kind of question a plan item asks. Used for follow-up phrasing and reporting.
 */
public enum QuestionType {
    BEHAVIORAL,
    TECHNICAL,
    SITUATIONAL,
    CULTURAL
}
