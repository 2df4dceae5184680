package com.fixforge.core.editor;

/**
 * Prompt text sent to the code editor. Wording is free to change; callers
 * depend only on the review prompt asking for JSON.
 */
final class EditorInstructions {

    private EditorInstructions() {}

    static String reviewRepository() {
        return """
                Review the structure of this project and tell me:
                1. What the project does
                2. How the code is organised
                3. The main modules and files
                4. The technology stack
                5. What could be improved""";
    }

    static String fixIssue(String title, String body) {
        return """
                Fix the following issue.

                ## Issue title
                %s

                ## Issue description
                %s

                Please:
                1. Analyse the cause of the problem
                2. Locate the relevant code
                3. Implement the fix
                4. Make sure the change does not break existing behaviour""".formatted(
                title != null ? title : "", body != null && !body.isBlank() ? body : "(no description)");
    }

    static String reviewDiff(String diff) {
        return """
                Review the following change as a pull request reviewer. Do not modify any files.

                %s

                Reply with a single JSON object of the form:
                {"findings": [{"title": "...", "body": "...", "priority": 0, "confidence_score": 0.9,
                  "file": "...", "line": 1}],
                 "overall_correctness": "patch is correct" or "patch is incorrect",
                 "overall_confidence_score": 0.9}
                Priority 0 is blocking, 3 is a nit.""".formatted(diff);
    }
}
