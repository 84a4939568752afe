package info.isaksson.erland.ontoumlcheck;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    private static Path copyFixture(Path dir, String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = MainSmokeTest.class.getResourceAsStream("/models/" + name)) {
            assertNotNull(in, "fixture must exist in test resources");
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void cleanModelExitsZeroAndWritesReport() throws IOException {
        Path tmpDir = Files.createTempDirectory("ontouml-check-");
        Path model = copyFixture(tmpDir, "marriage.json");
        Path report = tmpDir.resolve("out").resolve("report.md");

        int code = Main.run(new String[] {
                "--model", model.toString(),
                "--antipatterns", "true",
                "--report", report.toString(),
                "--fail-on-problems", "true"
        });

        assertEquals(0, code);
        String md = Files.readString(report);
        assertTrue(md.contains("- Model: `Marriage`"), md);
        assertTrue(md.contains("No problems found"), md);
    }

    @Test
    void problemsFailOnlyWhenAsked() throws IOException {
        Path tmpDir = Files.createTempDirectory("ontouml-check-");
        Path model = copyFixture(tmpDir, "free-role.json");

        assertEquals(0, Main.run(new String[] {model.toString(), "--antipatterns", "true"}));
        assertEquals(3, Main.run(new String[] {model.toString(), "--fail-on-problems", "true"}));
        assertEquals(0, Main.run(new String[] {model.toString(), "--errors", "false", "--fail-on-problems", "true"}));
    }

    @Test
    void unreadableSnapshotIsAnIoFailure() throws IOException {
        Path tmpDir = Files.createTempDirectory("ontouml-check-");
        Path broken = tmpDir.resolve("broken.json");
        Files.writeString(broken, "{ \"elements\": [ ");

        assertEquals(2, Main.run(new String[] {"--model", broken.toString()}));
    }
}
