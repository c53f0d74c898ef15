package com.openworkout.owf.loader.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.openworkout.owf.Owf;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.loader.LoaderMessage;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ValidationRunnerTest {

    @Test
    void duplicateNamesAcrossSessionsAreReported() throws Exception {
        Document document =
                Owf.parse("# Core\n- plank 60s\n\n## Day\n# Core\n- plank 90s\n# Run\n- run 5km\n");
        List<LoaderMessage> messages = ValidationRunner.defaultRules().run(document);
        assertEquals(1, messages.size());
        LoaderMessage message = messages.get(0);
        assertEquals(LoaderMessage.Level.WARNING, message.getLevel());
        assertEquals("Duplicate workout name 'Core' (first defined on line 1)", message.getMessage());
        assertEquals(5, message.getLine());
    }

    @Test
    void anonymousWorkoutsAreNotDuplicates() throws Exception {
        Document document = Owf.parse("- run 1km\n\n#\n- run 2km\n");
        assertTrue(ValidationRunner.defaultRules().run(document).isEmpty());
    }

    @Test
    void runsRulesInOrder() throws Exception {
        ValidationRule first =
                document -> List.of(new LoaderMessage(LoaderMessage.Level.INFO, "first", "", 0));
        ValidationRule second =
                document -> List.of(new LoaderMessage(LoaderMessage.Level.ERROR, "second", "", 0));
        List<LoaderMessage> messages =
                new ValidationRunner(List.of(first, second)).run(Owf.parse("- run 1km"));
        assertEquals("first", messages.get(0).getMessage());
        assertEquals("second", messages.get(1).getMessage());
    }
}
