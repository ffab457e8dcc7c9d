package com.libragraph.depot.formats.archive;

import com.libragraph.depot.formats.manifest.BundleManifest.ManifestItem;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Pairs each manifest item with exactly one archive payload. A payload is claimed at most once.
 */
public class PayloadMatcher {

    private static final Logger log = Logger.getLogger(PayloadMatcher.class);

    public record Match(ManifestItem item, ArchivePayload payload) {
    }

    private final PayloadMatching mode;

    public PayloadMatcher(PayloadMatching mode) {
        this.mode = mode;
    }

    /**
     * @return one match per item, in item order
     * @throws ArchiveException when an item has no payload under the current mode
     */
    public List<Match> match(List<ManifestItem> items, List<ArchivePayload> payloads) {
        boolean[] claimed = new boolean[payloads.size()];
        List<Match> matches = new ArrayList<>(items.size());

        for (ManifestItem item : items) {
            int index = claim(payloads, claimed, p -> p.hash().matchesHex(item.hash()));

            if (index < 0 && mode == PayloadMatching.LENIENT) {
                index = claim(payloads, claimed,
                        p -> p.name().equals(item.binaryId()) || p.name().equals(item.target()));
                if (index >= 0) {
                    log.warnf("Payload %s for binary %s matched by name, not by hash %s",
                            payloads.get(index).name(), item.binaryId(), item.hash());
                } else {
                    index = claim(payloads, claimed, p -> true);
                    if (index >= 0) {
                        log.warnf("Payload %s assigned to binary %s (target %s) as the first unclaimed payload",
                                payloads.get(index).name(), item.binaryId(), item.target());
                    }
                }
            }

            if (index < 0) {
                throw new ArchiveException("No payload in archive for binary " + item.binaryId()
                        + " (target " + item.target() + ", hash " + item.hash() + ")");
            }
            matches.add(new Match(item, payloads.get(index)));
        }

        for (int i = 0; i < claimed.length; i++) {
            if (!claimed[i]) {
                log.warnf("Archive payload %s is not referenced by the manifest", payloads.get(i).name());
            }
        }
        return matches;
    }

    private static int claim(List<ArchivePayload> payloads, boolean[] claimed, Predicate<ArchivePayload> test) {
        for (int i = 0; i < payloads.size(); i++) {
            if (!claimed[i] && test.test(payloads.get(i))) {
                claimed[i] = true;
                return i;
            }
        }
        return -1;
    }
}
