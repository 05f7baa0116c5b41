package alertflow.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ChannelInvokerTest {

    private ChannelInvoker invoker;

    @AfterEach
    void tearDown() {
        if (invoker != null) {
            invoker.close();
        }
    }

    @Test
    void shouldRetryUntilSuccess() throws IOException {
        ChannelSender sender = sender();
        willThrow(new IOException("connection refused"))
                .willThrow(new IOException("connection refused"))
                .willAnswer(invocation -> null)
                .given(sender).send(any(), any());
        invoker = new ChannelInvoker(new ChannelSenderRegistry(Collections.singletonList(sender)), 1, 1, 5, 3);

        SendOutcome outcome = invoker.invoke(channel("webhook"), intent());

        assertThat(outcome.isSuccess(), is(true));
        assertThat(outcome.getAttempts(), is(3));
        verify(sender, times(3)).send(any(), any());
    }

    @Test
    void shouldReportLastErrorWhenAttemptsExhausted() throws IOException {
        ChannelSender sender = sender();
        willThrow(new IOException("Unexpected code 500")).given(sender).send(any(), any());
        invoker = new ChannelInvoker(new ChannelSenderRegistry(Collections.singletonList(sender)), 1, 1, 5, 2);

        SendOutcome outcome = invoker.invoke(channel("webhook"), intent());

        assertThat(outcome.isSuccess(), is(false));
        assertThat(outcome.getError(), equalTo("Unexpected code 500"));
        assertThat(outcome.getAttempts(), is(2));
    }

    @Test
    void shouldTimeOutSlowSender() throws IOException {
        ChannelSender sender = sender();
        willAnswer(invocation -> {
            Thread.sleep(5000);
            return null;
        }).given(sender).send(any(), any());
        invoker = new ChannelInvoker(new ChannelSenderRegistry(Collections.singletonList(sender)), 1, 1, 1, 1);

        SendOutcome outcome = invoker.invoke(channel("webhook"), intent());

        assertThat(outcome.isSuccess(), is(false));
        assertThat(outcome.getError(), equalTo("timeout after 1s"));
    }

    @Test
    void shouldFailUnknownChannelType() {
        invoker = new ChannelInvoker(new ChannelSenderRegistry(Collections.singletonList(sender())), 1, 1, 5, 3);

        SendOutcome outcome = invoker.invoke(channel("sms"), intent());

        assertThat(outcome.isSuccess(), is(false));
        assertThat(outcome.getAttempts(), is(0));
    }

    private static ChannelSender sender() {
        ChannelSender sender = mock(ChannelSender.class);
        given(sender.getType()).willReturn("webhook");
        return sender;
    }

    private static NotificationChannel channel(String type) {
        NotificationChannel channel = new NotificationChannel();
        channel.setId("ops");
        channel.setType(type);
        channel.setUrl("http://localhost/hook");
        return channel;
    }

    private static DispatchIntent intent() {
        return DispatchIntent.builder().alertId("a1").ruleId("r1").transitionId("t1").message("hello").build();
    }
}
