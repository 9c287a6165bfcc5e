package work.bridge.sdk.step;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Captures the call site of a step registration as a project-relative source location.
 */
final class SourceLocations {
    private static final Set<String> INTERNAL = Set.of(
        SourceLocations.class.getName(),
        StepRegistrar.class.getName(),
        Pipeline.class.getName()
    );
    private static final List<String> ROOT_MARKERS = List.of("pom.xml", ".git", "bridge.toml");
    private static final List<String> SOURCE_ROOTS = List.of("src/main/java", "src/test/java", "");

    private SourceLocations() {}

    static SourceLocation callSite() {
        Optional<StackWalker.StackFrame> frame = StackWalker.getInstance()
            .walk(frames -> frames.filter(f -> !INTERNAL.contains(f.getClassName())).findFirst());
        return frame.map(SourceLocations::toLocation).orElse(SourceLocation.unknown());
    }

    private static SourceLocation toLocation(StackWalker.StackFrame frame) {
        String fileName = frame.getFileName();
        if (fileName == null) {
            return SourceLocation.unknown();
        }
        String className = frame.getClassName();
        int lastDot = className.lastIndexOf('.');
        String packagePath = lastDot < 0 ? "" : className.substring(0, lastDot).replace('.', '/') + "/";
        String relative = packagePath + fileName;
        Integer line = frame.getLineNumber() > 0 ? frame.getLineNumber() : null;
        return new SourceLocation(resolveAgainstProject(relative), line);
    }

    private static String resolveAgainstProject(String relative) {
        Path cwd = Paths.get("").toAbsolutePath().normalize();
        for (Path dir = cwd; dir != null; dir = dir.getParent()) {
            if (!isProjectRoot(dir)) {
                continue;
            }
            for (String sourceRoot : SOURCE_ROOTS) {
                Path candidate = sourceRoot.isEmpty() ? dir.resolve(relative) : dir.resolve(sourceRoot).resolve(relative);
                if (Files.isRegularFile(candidate)) {
                    return dir.relativize(candidate).toString().replace('\\', '/');
                }
            }
        }
        return relative;
    }

    private static boolean isProjectRoot(Path dir) {
        for (String marker : ROOT_MARKERS) {
            if (Files.exists(dir.resolve(marker))) {
                return true;
            }
        }
        return false;
    }
}
