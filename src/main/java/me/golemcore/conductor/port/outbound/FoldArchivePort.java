package me.golemcore.conductor.port.outbound;

import me.golemcore.conductor.domain.model.FoldIndexEntry;
import me.golemcore.conductor.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Archive of transcript prefixes removed by folding.
 */
public interface FoldArchivePort {

    /**
     * Archives the folded messages and returns the archive id.
     */
    String archive(String projectRoot, String conversationId, List<Message> foldedMessages, String summary);

    /**
     * Most recent index entries, oldest first, at most {@code limit}.
     */
    List<FoldIndexEntry> list(String projectRoot, int limit);

    Optional<String> read(String projectRoot, String archiveId);
}
