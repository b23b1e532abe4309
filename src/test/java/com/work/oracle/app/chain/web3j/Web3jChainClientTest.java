package com.work.oracle.app.chain.web3j;

import com.work.oracle.core.exception.ReadException;
import com.work.oracle.core.exception.SubmissionException;
import com.work.oracle.core.exception.UnconfirmedSubmissionException;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignIdType;
import com.work.oracle.core.model.CampaignStatus;
import com.work.oracle.core.model.CallKind;
import com.work.oracle.core.model.ContractCall;
import com.work.oracle.core.model.TxReceipt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;

import static com.work.oracle.core.TestCampaigns.KOL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class Web3jChainClientTest {

    // hardhat 默认账户 #0
    private static final String PRIVATE_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String MARKETPLACE = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    private static final String TOKEN = "0xe7f1725e7734ce288f8367e1bb143e90bb3f0512";

    private Web3j web3j;
    private TransactionReceiptProcessor receipts;
    private Web3jChainClient client;

    @BeforeEach
    public void setUp() {
        web3j = mock(Web3j.class);
        receipts = mock(TransactionReceiptProcessor.class);
        client = new Web3jChainClient(web3j, Credentials.create(PRIVATE_KEY), 31337L, MARKETPLACE, TOKEN,
                CampaignIdType.UINT256, receipts);
    }

    @SuppressWarnings("unchecked")
    private static <T extends Response<?>> Request<?, T> request(T response) throws IOException {
        Request<?, T> req = mock(Request.class);
        doReturn(response).when(req).send();
        return req;
    }

    private void stubGasPrice() throws IOException {
        EthGasPrice gas = new EthGasPrice();
        gas.setResult("0x3b9aca00");
        doReturn(request(gas)).when(web3j).ethGasPrice();
    }

    private void stubSend(String txHash) throws IOException {
        EthSendTransaction sent = new EthSendTransaction();
        sent.setResult(txHash);
        doReturn(request(sent)).when(web3j).ethSendRawTransaction(anyString());
    }

    private static TransactionReceipt receipt(String status) {
        TransactionReceipt r = new TransactionReceipt();
        r.setStatus(status);
        r.setBlockNumber("0x10");
        return r;
    }

    @Test
    public void reads_campaign_via_eth_call() throws IOException {
        EthCall call = new EthCall();
        call.setResult(MarketplaceAbiTest.campaignInfo(100, 200, 1_000, 4));
        doReturn(request(call)).when(web3j).ethCall(any(), any(DefaultBlockParameter.class));

        Campaign c = client.getCampaignInfo(CampaignId.ofUint(BigInteger.ONE));

        assertEquals(CampaignStatus.DISCARDED, c.getStatus());
        assertEquals(BigInteger.valueOf(1_000), c.getTotalAmount());
    }

    @Test
    public void rpc_error_on_read_is_read_exception() throws IOException {
        EthCall call = new EthCall();
        call.setError(new Response.Error(-32000, "execution reverted"));
        doReturn(request(call)).when(web3j).ethCall(any(), any(DefaultBlockParameter.class));

        assertThrows(ReadException.class, () -> client.getCampaignInfo(CampaignId.ofUint(BigInteger.ONE)));
    }

    @Test
    public void io_failure_on_read_is_read_exception() throws IOException {
        Request<?, EthCall> req = mock(Request.class);
        when(req.send()).thenThrow(new IOException("connection refused"));
        doReturn(req).when(web3j).ethCall(any(), any(DefaultBlockParameter.class));

        assertThrows(ReadException.class, () -> client.getAllCampaigns());
    }

    @Test
    public void account_nonce_uses_pending_count() throws IOException {
        EthGetTransactionCount count = new EthGetTransactionCount();
        count.setResult("0x7");
        doReturn(request(count)).when(web3j).ethGetTransactionCount(eq("0xabc"), any(DefaultBlockParameter.class));

        assertEquals(7L, client.accountNonce("0xabc"));
    }

    @Test
    public void latest_block_timestamp_is_read_from_block() throws IOException {
        EthBlock.Block block = new EthBlock.Block();
        block.setTimestamp("0x64");
        EthBlock resp = new EthBlock();
        resp.setResult(block);
        doReturn(request(resp)).when(web3j).ethGetBlockByNumber(any(DefaultBlockParameter.class), eq(false));

        assertEquals(100L, client.latestBlockTimestamp());
    }

    @Test
    public void signs_transition_for_marketplace_with_given_nonce_and_gas() throws Exception {
        stubGasPrice();
        stubSend("0xhash");
        when(receipts.waitForTransactionReceipt("0xhash")).thenReturn(receipt("0x1"));
        CampaignId id = CampaignId.ofUint(BigInteger.valueOf(5));

        TxReceipt r = client.buildAndSubmit(ContractCall.transition(CallKind.DISCARD_CAMPAIGN, id), 3L, BigInteger.valueOf(100_000));

        ArgumentCaptor<String> signed = ArgumentCaptor.forClass(String.class);
        verify(web3j).ethSendRawTransaction(signed.capture());
        RawTransaction tx = TransactionDecoder.decode(signed.getValue());
        assertEquals(BigInteger.valueOf(3), tx.getNonce());
        assertEquals(BigInteger.valueOf(100_000), tx.getGasLimit());
        assertEquals(BigInteger.valueOf(1_000_000_000L), tx.getGasPrice());
        assertEquals(MARKETPLACE, tx.getTo().toLowerCase());
        assertEquals(Numeric.cleanHexPrefix(MarketplaceAbi.encodeTransition(CallKind.DISCARD_CAMPAIGN, id)),
                Numeric.cleanHexPrefix(tx.getData()));
        assertTrue(r.isSuccess());
        assertEquals(16L, r.getBlockNumber());
        assertEquals(3L, r.getNonce());
    }

    @Test
    public void transfer_goes_to_token_contract() throws Exception {
        stubGasPrice();
        stubSend("0xhash");
        when(receipts.waitForTransactionReceipt("0xhash")).thenReturn(receipt("0x1"));

        client.buildAndSubmit(ContractCall.transfer(CampaignId.ofUint(BigInteger.ONE), KOL, BigInteger.TEN), 0L, BigInteger.valueOf(100_000));

        ArgumentCaptor<String> signed = ArgumentCaptor.forClass(String.class);
        verify(web3j).ethSendRawTransaction(signed.capture());
        assertEquals(TOKEN, TransactionDecoder.decode(signed.getValue()).getTo().toLowerCase());
    }

    @Test
    public void reverted_receipt_is_reported_not_thrown() throws Exception {
        stubGasPrice();
        stubSend("0xhash");
        when(receipts.waitForTransactionReceipt("0xhash")).thenReturn(receipt("0x0"));

        TxReceipt r = client.buildAndSubmit(
                ContractCall.transition(CallKind.FULFIL_PROJECT_CAMPAIGN, CampaignId.ofUint(BigInteger.ONE)), 0L, BigInteger.valueOf(200_000));

        assertFalse(r.isSuccess());
    }

    @Test
    public void rejected_send_is_submission_exception() throws Exception {
        stubGasPrice();
        EthSendTransaction sent = new EthSendTransaction();
        sent.setError(new Response.Error(-32000, "nonce too low"));
        doReturn(request(sent)).when(web3j).ethSendRawTransaction(anyString());

        SubmissionException e = assertThrows(SubmissionException.class, () -> client.buildAndSubmit(
                ContractCall.transition(CallKind.DISCARD_CAMPAIGN, CampaignId.ofUint(BigInteger.ONE)), 0L, BigInteger.ONE));
        assertFalse(e instanceof UnconfirmedSubmissionException);
        verify(receipts, never()).waitForTransactionReceipt(anyString());
    }

    @Test
    public void receipt_timeout_after_broadcast_carries_tx_hash() throws Exception {
        stubGasPrice();
        stubSend("0xhash");
        when(receipts.waitForTransactionReceipt("0xhash")).thenThrow(new TransactionException("not mined"));

        UnconfirmedSubmissionException e = assertThrows(UnconfirmedSubmissionException.class, () -> client.buildAndSubmit(
                ContractCall.transition(CallKind.DISCARD_CAMPAIGN, CampaignId.ofUint(BigInteger.ONE)), 4L, BigInteger.ONE));
        assertEquals("0xhash", e.getTxHash());
        assertEquals(4L, e.getNonce());
    }
}
