package com.caffe.devicebinding.infrastructure.notify;

import com.caffe.devicebinding.domain.account.AccountMetadata;
import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.ResetRequest;
import com.caffe.devicebinding.domain.ports.NotifierPort;
import com.caffe.devicebinding.exception.ResetNotificationException;
import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotifier implements NotifierPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override public void sendDeviceResetRequested(ObserverAccount account, ResetRequest request) {
    requireRecipient(request);
    log.warn("Observer {} device reset {} REQUESTED, notifying {}: an administrator will review the request",
        account.getObserverId(), request.getId(), AccountMetadata.maskEmail(request.getContactEmail()));
  }

  @Override public void sendDeviceResetResolved(ObserverAccount account, ResetRequest request) {
    requireRecipient(request);
    log.warn("Observer {} device reset {} {}, notifying {}",
        account.getObserverId(), request.getId(), request.getStatus(), AccountMetadata.maskEmail(request.getContactEmail()));
  }

  private static void requireRecipient(ResetRequest request) {
    if (request.getContactEmail() == null || request.getContactEmail().isBlank()) {
      throw new ResetNotificationException("No contact channel for reset request " + request.getId());
    }
  }
}
