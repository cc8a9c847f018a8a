package org.neuralchilli.irflow.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.irflow.domain.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures and produces the embedded Hazelcast member holding the program store.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @Inject
    IrflowConfig irflowConfig;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        String clusterName = irflowConfig.store().clusterName();
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);

        // Embedded, single member
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        // Single member, no backups
        config.getMapConfig(irflowConfig.store().mapName())
                .setBackupCount(0)
                .setAsyncBackupCount(0);

        registerSerializers(config.getSerializationConfig());

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);
        log.info("Hazelcast instance created successfully");
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast instance");
            instance.getLifecycleService().shutdown();
        }
    }

    /**
     * Register the JSON serializer for programs. Shared with the test member configuration.
     */
    public static void registerSerializers(SerializationConfig serializationConfig) {
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);

        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(IrProgram.class)
                .setImplementation(new IrProgramSerializer()));
        log.debug("Registered IrProgramSerializer");
    }
}
