package com.mailflow.application.service;

import com.mailflow.application.port.in.ManageWatchUseCase;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.WatchStateStore;
import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class WatchService implements ManageWatchUseCase {

    private static final Logger log = LoggerFactory.getLogger(WatchService.class);

    private final MailboxClient mailbox;
    private final WatchStateStore store;

    public WatchService(MailboxClient mailbox, WatchStateStore store) {
        this.mailbox = mailbox;
        this.store = store;
    }

    @Override
    public Optional<WatchRegistration> getWatch(WatchKey key) {
        return store.load(key);
    }

    @Override
    public boolean cancelWatch(WatchKey key) {
        Optional<WatchRegistration> persisted = store.load(key);
        mailbox.stopWatch();
        store.clear(key);
        log.info("Watch cancelled: key={}, hadState={}", key, persisted.isPresent());
        return persisted.isPresent();
    }
}
