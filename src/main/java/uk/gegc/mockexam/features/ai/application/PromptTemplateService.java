package uk.gegc.mockexam.features.ai.application;

public interface PromptTemplateService {

    /**
     * Build the question paper prompt for one subject.
     * The count, difficulty and chapters appear in the prompt verbatim.
     *
     * @param exam         exam key, e.g. JEE
     * @param subject      subject name
     * @param chaptersCsv  chapters joined by ", "
     * @param numQuestions number of questions to ask the model for
     * @param difficulty   difficulty label (Easy, Medium, Hard)
     * @return the complete prompt
     */
    String buildQuestionPaperPrompt(String exam, String subject, String chaptersCsv, int numQuestions, String difficulty);

    /**
     * Load a template by its path under {@code classpath:prompts/}
     */
    String loadPromptTemplate(String templateName);
}
