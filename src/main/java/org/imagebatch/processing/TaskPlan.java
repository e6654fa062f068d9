package org.imagebatch.processing;

import java.nio.file.Path;
import java.util.List;

/**
 * Work items of one task together with the planning-time counts.
 * {@code skipped + workItems.size() == discovered} always holds.
 */
public record TaskPlan(Path outputDir, FormatResolution formats, List<WorkItem> workItems, int discovered, int skipped) {

    public TaskPlan {
        workItems = List.copyOf(workItems);
        if (skipped + workItems.size() != discovered) {
            throw new IllegalStateException("Plan does not add up: " + skipped + " skipped + "
                    + workItems.size() + " scheduled != " + discovered + " discovered");
        }
    }

    public int toProcess() {
        return workItems.size();
    }
}
