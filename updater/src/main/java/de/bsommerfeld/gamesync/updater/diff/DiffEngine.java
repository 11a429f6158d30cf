package de.bsommerfeld.gamesync.updater.diff;

import de.bsommerfeld.gamesync.updater.hash.HashUtil;
import de.bsommerfeld.gamesync.updater.model.ContentEntry;
import de.bsommerfeld.gamesync.updater.model.DirEntry;
import de.bsommerfeld.gamesync.updater.model.FileEntry;
import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.SyncPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Computes the minimal {@link SyncPlan} that turns a local tree into the
 * tree a manifest describes.
 *
 * <h3>Walk</h3>
 * Both trees are walked in lock-step by child name, each directory before
 * its children and siblings in sorted order:
 * <ul>
 * <li>remote only: fetch (every file of a remote-only directory)</li>
 * <li>both, hashes differ: fetch</li>
 * <li>both, hashes equal: verify if the path matches the recheck rules</li>
 * <li>local only: delete, unless excluded. Local-only directories are
 * flattened to their files so excluded files inside them survive.</li>
 * </ul>
 *
 * <h3>Type conflicts</h3>
 * Where one side has a file and the other a directory, the local side is
 * planned for deletion and the remote side for fetching; the orchestrator
 * clears the conflicting path right before it writes. If the local side
 * holds excluded content, the remote entry is skipped instead and the local
 * content kept.
 *
 * <p>
 * The engine is a pure function of its inputs and performs no I/O.
 */
public final class DiffEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiffEngine.class);

    private final DiffRules rules;

    public DiffEngine(DiffRules rules) {
        this.rules = rules;
    }

    public SyncPlan diff(DirEntry local, Manifest remote) {
        return diff(local, remote.root());
    }

    public SyncPlan diff(DirEntry local, DirEntry remote) {
        Accumulator acc = new Accumulator();
        walk(local, remote, acc);
        SyncPlan plan = new SyncPlan(acc.fetch, acc.verify, acc.delete);
        LOG.debug("Planned {} fetches, {} verifications, {} deletions",
                plan.toFetch().size(), plan.toVerify().size(), plan.toDelete().size());
        return plan;
    }

    private void walk(DirEntry local, DirEntry remote, Accumulator acc) {
        SortedMap<String, ContentEntry> localChildren = local.children();
        SortedMap<String, ContentEntry> remoteChildren = remote.children();

        TreeSet<String> names = new TreeSet<>(localChildren.keySet());
        names.addAll(remoteChildren.keySet());

        for (String name : names) {
            ContentEntry l = localChildren.get(name);
            ContentEntry r = remoteChildren.get(name);

            if (l == null) {
                fetchAll(r, acc);
            } else if (r == null) {
                deleteAll(l, acc);
            } else if (l instanceof FileEntry lf && r instanceof FileEntry rf) {
                compareFiles(lf, rf, acc);
            } else if (l instanceof DirEntry ld && r instanceof DirEntry rd) {
                walk(ld, rd, acc);
            } else {
                resolveConflict(l, r, acc);
            }
        }
    }

    private void compareFiles(FileEntry local, FileEntry remote, Accumulator acc) {
        boolean same = local.size() == remote.size() && HashUtil.matches(remote.contentHash(), local.contentHash());
        if (!same) {
            acc.fetch.add(remote);
        } else if (rules.recheck().matches(remote.relativePath())) {
            acc.verify.add(remote);
        }
    }

    private void resolveConflict(ContentEntry local, ContentEntry remote, Accumulator acc) {
        if (holdsExcluded(local)) {
            LOG.warn("Keeping protected local content at '{}' that conflicts with the manifest",
                    local.relativePath());
            return;
        }
        deleteAll(local, acc);
        fetchAll(remote, acc);
    }

    private void fetchAll(ContentEntry remote, Accumulator acc) {
        if (remote instanceof FileEntry file) {
            acc.fetch.add(file);
        } else if (remote instanceof DirEntry dir) {
            acc.fetch.addAll(dir.files());
        }
    }

    private void deleteAll(ContentEntry local, Accumulator acc) {
        if (local instanceof FileEntry file) {
            if (!rules.exclusions().matches(file.relativePath()))
                acc.delete.add(file.relativePath());
        } else if (local instanceof DirEntry dir) {
            for (FileEntry file : dir.files()) {
                if (!rules.exclusions().matches(file.relativePath()))
                    acc.delete.add(file.relativePath());
            }
        }
    }

    private boolean holdsExcluded(ContentEntry local) {
        if (rules.exclusions().matches(local.relativePath()))
            return true;
        if (local instanceof DirEntry dir)
            return dir.files().stream().anyMatch(f -> rules.exclusions().matches(f.relativePath()));
        return false;
    }

    private static final class Accumulator {
        final List<FileEntry> fetch = new ArrayList<>();
        final List<FileEntry> verify = new ArrayList<>();
        final List<String> delete = new ArrayList<>();
    }
}
