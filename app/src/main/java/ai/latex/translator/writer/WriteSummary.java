package ai.latex.translator.writer;

import java.util.List;

/**
 * Files produced by one {@link ProjectWriter#write} call, relative to the output root.
 */
public record WriteSummary(List<String> sources, List<String> assets, boolean staged) {

    public WriteSummary {
        sources = List.copyOf(sources);
        assets = List.copyOf(assets);
    }

    public int totalFiles() {
        return sources.size() + assets.size();
    }
}
