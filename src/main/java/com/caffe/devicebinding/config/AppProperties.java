package com.caffe.devicebinding.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private DeviceBinding deviceBinding = new DeviceBinding();
    public DeviceBinding getDeviceBinding(){ return deviceBinding; }

    public static class DeviceBinding {
        private double similarityThreshold = 0.95;
        private long mismatchWindowMinutes = 30;
        private String hashAlgorithm = "SHA-256";
        private long fingerprintTimeoutMillis = 3000;

        public double getSimilarityThreshold(){ return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold){ this.similarityThreshold = similarityThreshold; }

        public long getMismatchWindowMinutes(){ return mismatchWindowMinutes; }
        public void setMismatchWindowMinutes(long mismatchWindowMinutes){ this.mismatchWindowMinutes = mismatchWindowMinutes; }

        public String getHashAlgorithm(){ return hashAlgorithm; }
        public void setHashAlgorithm(String hashAlgorithm){ this.hashAlgorithm = hashAlgorithm; }

        public long getFingerprintTimeoutMillis(){ return fingerprintTimeoutMillis; }
        public void setFingerprintTimeoutMillis(long fingerprintTimeoutMillis){ this.fingerprintTimeoutMillis = fingerprintTimeoutMillis; }
    }
}
