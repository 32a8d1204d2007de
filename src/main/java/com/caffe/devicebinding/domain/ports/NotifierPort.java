package com.caffe.devicebinding.domain.ports;

import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.ResetRequest;

/**
 * Out-of-band channel to the account holder. Delivery is best effort; implementations
 * signal failure with {@link com.caffe.devicebinding.exception.ResetNotificationException}.
 */
public interface NotifierPort {

    void sendDeviceResetRequested(ObserverAccount account, ResetRequest request);

    void sendDeviceResetResolved(ObserverAccount account, ResetRequest request);
}
