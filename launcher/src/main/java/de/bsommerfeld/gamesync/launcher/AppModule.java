package de.bsommerfeld.gamesync.launcher;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.gamesync.core.config.ConfigLoader;
import de.bsommerfeld.gamesync.core.config.DownloadConfig;
import de.bsommerfeld.gamesync.core.config.SyncConfig;
import de.bsommerfeld.gamesync.core.event.ApplicationEventBus;
import de.bsommerfeld.gamesync.updater.api.SyncClient;
import de.bsommerfeld.gamesync.updater.diff.DiffEngine;
import de.bsommerfeld.gamesync.updater.diff.DiffRules;
import de.bsommerfeld.gamesync.updater.download.DownloadOrchestrator;
import de.bsommerfeld.gamesync.updater.download.FileFetcher;
import de.bsommerfeld.gamesync.updater.download.HttpFileFetcher;
import de.bsommerfeld.gamesync.updater.download.LocalFileFetcher;
import de.bsommerfeld.gamesync.updater.download.OrchestratorSettings;
import de.bsommerfeld.gamesync.updater.download.SchemeRoutingFileFetcher;
import de.bsommerfeld.gamesync.updater.hash.DirectoryHasher;
import de.bsommerfeld.gamesync.updater.hash.HashOptions;
import de.bsommerfeld.gamesync.updater.manifest.ManifestCodec;
import de.bsommerfeld.gamesync.updater.manifest.ManifestKeys;
import de.bsommerfeld.gamesync.updater.manifest.ManifestPublisher;
import de.bsommerfeld.gamesync.updater.manifest.ManifestSigner;
import de.bsommerfeld.gamesync.updater.manifest.ManifestVerifier;
import de.bsommerfeld.gamesync.updater.progress.EventBusProgressBridge;
import de.bsommerfeld.gamesync.updater.progress.ProgressChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.KeyPair;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;

/**
 * Guice module wiring configuration, the event bus and the update engine.
 *
 * <p>
 * Signing keys are loaded lazily: a client that only syncs never touches the
 * private key, and a publishing host generates its key pair on first use.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final StorageResolver storage;

    AppModule(StorageResolver storage) {
        this.storage = storage;
    }

    @Override
    protected void configure() {
        try {
            LOG.info("Loading configuration from: {}", storage.configFile());
            SyncConfig config = ConfigLoader.from(storage.configFile()).load(SyncConfig.class, SyncConfig::new);

            bind(SyncConfig.class).toInstance(config);
            bind(DownloadConfig.class).toInstance(config.getDownload());
            bind(StorageResolver.class).toInstance(storage);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration", e);
        }
    }

    @Provides
    @Singleton
    ProgressChannel progressChannel(DownloadConfig download, ApplicationEventBus eventBus) {
        ProgressChannel channel = new ProgressChannel(
                Executors.newCachedThreadPool(
                        new ThreadFactoryBuilder().setNameFormat("gamesync-progress-%d").setDaemon(true).build()),
                download.getProgressQueueLimit());
        EventBusProgressBridge.connect(channel, eventBus);
        return channel;
    }

    @Provides
    @Singleton
    FileFetcher fileFetcher(DownloadConfig download) {
        return new SchemeRoutingFileFetcher(List.of(HttpFileFetcher.fromConfig(download), new LocalFileFetcher()));
    }

    @Provides
    @Singleton
    HashOptions hashOptions(SyncConfig config) {
        return HashOptions.fromConfig(config.getHashing());
    }

    @Provides
    @Singleton
    DirectoryHasher directoryHasher(HashOptions options) {
        return new DirectoryHasher(options);
    }

    @Provides
    @Singleton
    DiffEngine diffEngine(SyncConfig config) {
        return new DiffEngine(DiffRules.fromConfig(config.getSync()));
    }

    @Provides
    @Singleton
    DownloadOrchestrator downloadOrchestrator(FileFetcher fetcher, ProgressChannel channel, DownloadConfig download,
            HashOptions options) {
        return new DownloadOrchestrator(fetcher, channel, OrchestratorSettings.fromConfig(download),
                options.policy());
    }

    @Provides
    @Singleton
    ManifestCodec manifestCodec() {
        return new ManifestCodec();
    }

    @Provides
    @Singleton
    ManifestVerifier manifestVerifier(SyncConfig config, ManifestCodec codec) {
        try {
            return new ManifestVerifier(
                    ManifestKeys.loadPublicKey(storage.resolve(config.getKeys().getPublicKey())), codec);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load the trusted public key", e);
        }
    }

    @Provides
    @Singleton
    KeyPair signingKeys(SyncConfig config) {
        try {
            return ManifestKeys.loadOrGenerate(
                    storage.resolve(config.getKeys().getPrivateKey()),
                    storage.resolve(config.getKeys().getPublicKey()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load or create the signing key pair", e);
        }
    }

    @Provides
    @Singleton
    ManifestPublisher manifestPublisher(DirectoryHasher hasher, KeyPair keys, ManifestCodec codec) {
        return new ManifestPublisher(hasher, new ManifestSigner(keys.getPrivate(), codec), codec, Clock.systemUTC());
    }

    @Provides
    @Singleton
    SyncClient syncClient(ManifestVerifier verifier, DirectoryHasher hasher, DiffEngine diffEngine,
            DownloadOrchestrator orchestrator) {
        return new SyncClient(verifier, hasher, diffEngine, orchestrator);
    }
}
