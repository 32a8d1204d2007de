package com.caffe.devicebinding.config;

import com.caffe.devicebinding.application.DeviceFingerprintGenerator;
import com.caffe.devicebinding.domain.DeviceFingerprintVerifier;
import com.caffe.devicebinding.domain.binding.DeviceBindingStateMachine;
import com.caffe.devicebinding.domain.fingerprint.FingerprintHasher;
import com.caffe.devicebinding.infrastructure.signals.JvmSignalSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

@Configuration
public class DeviceBindingConfig {

    private static final Logger log = LoggerFactory.getLogger(DeviceBindingConfig.class);

    /**
     * Bounded pool for host fingerprint generation: a stuck AWT call holds one of these
     * threads, and once pool and queue are full callers get a fallback digest. Kept out of
     * the context, where an Executor bean would displace Boot's task executor.
     */
    private final ThreadPoolTaskExecutor hostFingerprintExecutor = new ThreadPoolTaskExecutor();

    @Bean
    public DeviceFingerprintVerifier deviceFingerprintVerifier(AppProperties props) {
        double threshold = props.getDeviceBinding().getSimilarityThreshold();
        log.info("Device fingerprint verifier initialized with similarity threshold: {}", threshold);
        return new DeviceFingerprintVerifier(threshold);
    }

    @Bean
    public DeviceBindingStateMachine deviceBindingStateMachine() {
        return new DeviceBindingStateMachine();
    }

    @Bean
    public FingerprintHasher fingerprintHasher(AppProperties props) {
        return new FingerprintHasher(props.getDeviceBinding().getHashAlgorithm());
    }

    @PreDestroy
    void shutdownHostFingerprintExecutor() {
        hostFingerprintExecutor.shutdown();
    }

    /** Fingerprint of the JVM this service runs in, reported by the debug endpoint. */
    @Bean
    public DeviceFingerprintGenerator hostFingerprintGenerator(FingerprintHasher hasher, AppProperties props) {
        hostFingerprintExecutor.setCorePoolSize(1);
        hostFingerprintExecutor.setMaxPoolSize(2);
        hostFingerprintExecutor.setQueueCapacity(4);
        hostFingerprintExecutor.setDaemon(true);
        hostFingerprintExecutor.setThreadNamePrefix("host-fingerprint-");
        hostFingerprintExecutor.initialize();
        return new DeviceFingerprintGenerator(new JvmSignalSource(), hasher,
                Duration.ofMillis(props.getDeviceBinding().getFingerprintTimeoutMillis()), hostFingerprintExecutor);
    }
}
