package com.metallisense.common.exception;

import java.util.List;

public class UnknownGradeException extends RuntimeException {
    private final String grade;

    public UnknownGradeException(String grade, List<String> availableGrades) {
        super("Unknown grade: " + grade + ". Available grades: " + availableGrades);
        this.grade = grade;
    }

    public String getGrade() {
        return grade;
    }
}
