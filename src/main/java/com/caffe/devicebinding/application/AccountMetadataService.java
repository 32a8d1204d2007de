package com.caffe.devicebinding.application;

import com.caffe.devicebinding.domain.account.AccountMetadata;
import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.ports.AccountDirectory;
import com.caffe.devicebinding.domain.ports.BindingStore;
import com.caffe.devicebinding.domain.ports.ResetRequestRepository;
import com.caffe.devicebinding.exception.AccountNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Read side for the mismatch alert and the bearer's own binding status. Nothing here
 * ever returns a digest.
 */
@Service
public class AccountMetadataService {

    private final AccountDirectory accounts;
    private final BindingStore bindings;
    private final ResetRequestRepository resetRequests;

    public AccountMetadataService(AccountDirectory accounts, BindingStore bindings,
                                  ResetRequestRepository resetRequests) {
        this.accounts = accounts;
        this.bindings = bindings;
        this.resetRequests = resetRequests;
    }

    @Transactional(readOnly = true)
    public AccountMetadata lookup(String username) {
        ObserverAccount account = accounts.findByUsername(username)
                .orElseThrow(() -> new AccountNotFoundException("Account not found: " + username));
        boolean resetPending = resetRequests.findPendingByAccountId(account.getId()).isPresent();
        return new AccountMetadata(account.getUsername(), AccountMetadata.maskEmail(account.getEmail()),
                account.getObserverId(), resetPending);
    }

    @Transactional(readOnly = true)
    public Optional<FingerprintBinding> bindingOf(String username) {
        return accounts.findByUsername(username)
                .flatMap(account -> bindings.findByAccountId(account.getId()));
    }
}
