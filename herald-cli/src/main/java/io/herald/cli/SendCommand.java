package io.herald.cli;

import io.herald.core.dispatch.DispatchResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "send", description = "Send a one-off test message without storing a task")
public final class SendCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-w", "--webhook"}, required = true, description = "Webhook send URL")
    String webhookUrl;

    @Option(names = {"-k", "--kind"}, defaultValue = "text", description = "text, markdown, image or file")
    String kind;

    @Option(names = {"-c", "--content"}, description = "Message content for text and markdown")
    String content;

    @Option(names = {"-f", "--file"}, description = "Attachment path for image and file")
    String filePath;

    public SendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            DispatchResult result = context.runtime().taskService().testSend(webhookUrl, kind, content, filePath);
            if (result.success()) {
                System.out.println("Message sent");
                return 0;
            }
            System.err.println("Send failed: " + result.status() + " " + result.message());
            return 1;
        } catch (Exception e) {
            System.err.println("Send failed: " + e.getMessage());
            return 1;
        }
    }
}
