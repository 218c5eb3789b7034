package com.ryuqq.conductor.workflow.operation;

/**
 * AI 요청 프롬프트.
 */
final class Prompts {

    private Prompts() {
    }

    static String commitAnalysis(String diff, String language) {
        return "You are a senior engineer reviewing uncommitted work before it is committed.\n"
            + "Analyze the following git changes and answer in " + language + ".\n\n"
            + "Provide:\n"
            + "1. A conventional commit title (type(scope): description, at most 72 characters).\n"
            + "2. A short description of what changed and why.\n"
            + "3. Any breaking changes, or \"None\".\n"
            + "4. Suggested tests for the change.\n"
            + "5. Security considerations, or \"None\".\n\n"
            + "Git changes:\n"
            + "```diff\n" + diff + "\n```\n";
    }

    static String releaseNotes(String structuredNotes, String language) {
        return "Rewrite the following structured release data as polished release notes in " + language + ".\n"
            + "Keep every commit reference and every breaking change. Do not invent information; "
            + "use only the data provided. Answer with markdown only.\n\n"
            + structuredNotes;
    }
}
