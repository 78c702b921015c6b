package com.txprocessor.engine;

import com.txprocessor.model.AccountSnapshot;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 汇总: 等待所有 Actor 结束，按首次出现顺序收集账户终态
 */
public class AccountCollector {

    public CompletableFuture<Map<Integer, AccountSnapshot>> collect(Map<Integer, AccountActor> routingTable) {
        List<CompletableFuture<AccountSnapshot>> terminations = routingTable.values().stream()
                .map(AccountActor::termination)
                .collect(Collectors.toList());

        return CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> toReport(terminations));
    }

    private Map<Integer, AccountSnapshot> toReport(Collection<CompletableFuture<AccountSnapshot>> terminations) {
        Map<Integer, AccountSnapshot> accounts = new LinkedHashMap<>();
        for (CompletableFuture<AccountSnapshot> termination : terminations) {
            AccountSnapshot snapshot = termination.join();
            accounts.put(snapshot.getClientId(), snapshot);
        }
        return accounts;
    }
}
