package com.caffe.devicebinding.domain.fingerprint;

/**
 * Platform capability that observes the local environment. One implementation per
 * client platform; everything downstream depends only on this interface so it can be
 * fed synthetic signal sets.
 *
 * <p>Implementations must not throw because a platform API is missing: the affected
 * field is reported as {@link SignalSet#UNKNOWN}.
 */
@FunctionalInterface
public interface SignalSource {

    SignalSet collect();
}
