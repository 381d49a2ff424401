package nl.bytesoflife.deltatokn.project;

import java.nio.file.Path;
import java.util.Optional;

public record ProjectRoot(Optional<Path> rootFile, Optional<String> projectName) {

    public static ProjectRoot none() {
        return new ProjectRoot(Optional.empty(), Optional.empty());
    }

    public static ProjectRoot of(Path rootFile, String projectName) {
        return new ProjectRoot(Optional.of(rootFile), Optional.of(projectName));
    }

    public boolean isFound() {
        return rootFile.isPresent();
    }
}
