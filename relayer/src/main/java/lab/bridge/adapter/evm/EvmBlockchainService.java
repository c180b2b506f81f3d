package lab.bridge.adapter.evm;

import lab.bridge.chain.BlockchainService;
import lab.bridge.chain.BridgeContractCounterparty;
import lab.bridge.chain.BridgeContractInitiator;
import lab.bridge.chain.ContractCallException;
import lab.bridge.chain.ContractCallResult;
import lab.bridge.chain.ContractEvent;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.HashLockPreImage;
import lab.bridge.domain.transfer.LockDetails;
import lab.bridge.stream.EventSource;
import lab.bridge.stream.MailboxEventSource;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Chain one over JSON-RPC. Bridge contract logs are pulled with {@code eth_getLogs} on a fixed delay
 * and published in block order; contract calls are signed locally and sent with
 * {@code eth_sendRawTransaction}. A call result means the node accepted the transaction, not that it
 * was mined: inclusion shows up later as a contract event.
 */
@Slf4j
public class EvmBlockchainService implements BlockchainService<EvmAddress> {

    private final String name;
    private final Web3j web3j;
    private final Signer signer;
    private final EvmChainSettings settings;
    private final MailboxEventSource<ContractEvent<EvmAddress>> events;

    private final ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "evm-log-poller");
        thread.setDaemon(true);
        return thread;
    });

    // Poller thread only.
    private BigInteger nextBlock;
    private BigInteger nextNonce;

    private final BridgeContractInitiator<EvmAddress> initiatorContract = new BridgeContractInitiator<>() {
        @Override
        public CompletableFuture<ContractCallResult> completeBridgeTransfer(BridgeTransferId id, HashLockPreImage preImage) {
            return send("initiator.complete", settings.initiatorContract(), () -> EvmBridgeAbi.completeBridgeTransfer(id, preImage));
        }

        @Override
        public CompletableFuture<ContractCallResult> refundBridgeTransfer(BridgeTransferId id) {
            return send("initiator.refund", settings.initiatorContract(), () -> EvmBridgeAbi.refundBridgeTransfer(id));
        }
    };

    private final BridgeContractCounterparty<EvmAddress> counterpartyContract = new BridgeContractCounterparty<>() {
        @Override
        public CompletableFuture<ContractCallResult> lockBridgeTransfer(LockDetails<EvmAddress> details) {
            return send("counterparty.lock", settings.counterpartyContract(), () -> EvmBridgeAbi.lockBridgeTransfer(details));
        }

        @Override
        public CompletableFuture<ContractCallResult> completeBridgeTransfer(BridgeTransferId id, HashLockPreImage preImage) {
            return send("counterparty.complete", settings.counterpartyContract(), () -> EvmBridgeAbi.completeBridgeTransfer(id, preImage));
        }

        @Override
        public CompletableFuture<ContractCallResult> abortBridgeTransfer(BridgeTransferId id) {
            return send("counterparty.abort", settings.counterpartyContract(), () -> EvmBridgeAbi.abortBridgeTransfer(id));
        }
    };

    public EvmBlockchainService(String name, Web3j web3j, Signer signer, EvmChainSettings settings) {
        this.name = name;
        this.web3j = web3j;
        this.signer = signer;
        this.settings = settings;
        this.events = new MailboxEventSource<>(name);
        this.nextBlock = settings.startBlock();
    }

    public void start() {
        ensureConnectedChainIdMatchesConfigured();
        poller.scheduleWithFixedDelay(this::pollLogs, 0, settings.pollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("event=evm_chain.started chain={} chainId={} relayer={} initiator={} counterparty={} startBlock={}",
                name, settings.chainId(), signer.getAddress(), settings.initiatorContract(), settings.counterpartyContract(), nextBlock);
    }

    public void stop() {
        poller.shutdownNow();
        log.info("event=evm_chain.stopped chain={}", name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EventSource<ContractEvent<EvmAddress>> events() {
        return events;
    }

    @Override
    public BridgeContractInitiator<EvmAddress> initiatorContract() {
        return initiatorContract;
    }

    @Override
    public BridgeContractCounterparty<EvmAddress> counterpartyContract() {
        return counterpartyContract;
    }

    void pollLogs() {
        try {
            EthBlockNumber head = web3j.ethBlockNumber().send();
            if (head.hasError()) {
                log.warn("event=evm_chain.poll.head_error chain={} error={}", name, head.getError().getMessage());
                return;
            }
            BigInteger latest = head.getBlockNumber();
            if (nextBlock == null) {
                nextBlock = latest;
            }
            while (nextBlock.compareTo(latest) <= 0) {
                BigInteger to = nextBlock.add(BigInteger.valueOf(settings.maxBlockRange() - 1L)).min(latest);
                if (!fetchRange(nextBlock, to)) {
                    return;
                }
                nextBlock = to.add(BigInteger.ONE);
            }
        } catch (EvmEventDecodingException e) {
            // Skipping the log would lose a swap; stop the feed and let the relay raise it.
            log.error("event=evm_chain.poll.decode_failed chain={} reason={}", name, e.getMessage(), e);
            events.fail(e);
            poller.shutdown();
        } catch (IOException | RuntimeException e) {
            log.warn("event=evm_chain.poll.failed chain={} nextBlock={} reason={}", name, nextBlock, e.getMessage());
        }
    }

    // Returns false when the node answered with an error; the range is retried on the next tick.
    private boolean fetchRange(BigInteger from, BigInteger to) throws IOException {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(from),
                DefaultBlockParameter.valueOf(to),
                List.of(settings.initiatorContract(), settings.counterpartyContract())
        );
        EthLog response = web3j.ethGetLogs(filter).send();
        if (response.hasError()) {
            log.warn("event=evm_chain.poll.logs_error chain={} from={} to={} error={}", name, from, to, response.getError().getMessage());
            return false;
        }
        int published = 0;
        for (EthLog.LogResult<?> result : response.getLogs()) {
            if (!(result.get() instanceof Log entry)) {
                continue;
            }
            Optional<? extends ContractEvent<EvmAddress>> decoded = decode(entry);
            if (decoded.isPresent()) {
                events.publish(decoded.get());
                published++;
            }
        }
        log.debug("event=evm_chain.poll.range chain={} from={} to={} published={}", name, from, to, published);
        return true;
    }

    private Optional<? extends ContractEvent<EvmAddress>> decode(Log entry) {
        if (settings.initiatorContract().equalsIgnoreCase(entry.getAddress())) {
            return EvmBridgeAbi.decodeInitiatorLog(entry);
        }
        if (settings.counterpartyContract().equalsIgnoreCase(entry.getAddress())) {
            return EvmBridgeAbi.decodeCounterpartyLog(entry);
        }
        return Optional.empty();
    }

    private synchronized CompletableFuture<ContractCallResult> send(
            String operation,
            String contractAddress,
            Supplier<Function> functionSupplier
    ) {
        try {
            String data = FunctionEncoder.encode(functionSupplier.get());
            BigInteger nonce = allocateNonce();
            RawTransaction rawTransaction = RawTransaction.createTransaction(
                    settings.chainId(),
                    nonce,
                    settings.gasLimit(),
                    contractAddress,
                    BigInteger.ZERO,
                    data,
                    settings.maxPriorityFeePerGas(),
                    settings.maxFeePerGas()
            );
            String signedTxHex = signer.sign(rawTransaction, settings.chainId());
            log.info("event=evm_chain.call.send chain={} operation={} contract={} nonce={}", name, operation, contractAddress, nonce);

            return web3j.ethSendRawTransaction(signedTxHex).sendAsync().thenApply(sent -> {
                if (sent.hasError()) {
                    resetNonce();
                    throw new ContractCallException("EVM RPC rejected " + operation + ": " + sent.getError().getMessage());
                }
                String txHash = sent.getTransactionHash();
                if (txHash == null || txHash.isBlank()) {
                    throw new ContractCallException("RPC returned an empty tx hash for " + operation);
                }
                log.info("event=evm_chain.call.accepted chain={} operation={} txHash={}", name, operation, txHash);
                return new ContractCallResult(txHash, true);
            });
        } catch (IOException e) {
            resetNonce();
            return CompletableFuture.failedFuture(new ContractCallException("Failed to execute EVM RPC request for " + operation, e));
        } catch (ContractCallException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // Pending nonce is read once, then counted locally so back-to-back calls do not collide.
    private synchronized BigInteger allocateNonce() throws IOException {
        if (nextNonce == null) {
            EthGetTransactionCount count = web3j.ethGetTransactionCount(signer.getAddress(), DefaultBlockParameterName.PENDING).send();
            if (count.hasError()) {
                throw new ContractCallException("Failed to fetch nonce from RPC: " + count.getError().getMessage());
            }
            nextNonce = count.getTransactionCount();
        }
        BigInteger allocated = nextNonce;
        nextNonce = nextNonce.add(BigInteger.ONE);
        return allocated;
    }

    private synchronized void resetNonce() {
        nextNonce = null;
    }

    // Guards against sending relayer transactions to the wrong network when the URL and config disagree.
    private void ensureConnectedChainIdMatchesConfigured() {
        try {
            EthChainId chainIdResponse = web3j.ethChainId().send();
            if (chainIdResponse.hasError()) {
                throw new IllegalStateException("Failed to verify chain id from RPC: " + chainIdResponse.getError().getMessage());
            }
            long remoteChainId = chainIdResponse.getChainId().longValue();
            if (remoteChainId != settings.chainId()) {
                throw new IllegalStateException("Connected RPC chain id mismatch. expected=" + settings.chainId() + ", actual=" + remoteChainId);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to verify chain id from RPC", e);
        }
    }
}
