package io.herald.core.dispatch;

public record OutboundMessage(MessageKind kind, String content, String filePath) {

    public static OutboundMessage text(String content) {
        return new OutboundMessage(MessageKind.TEXT, content, null);
    }

    public static OutboundMessage markdown(String content) {
        return new OutboundMessage(MessageKind.MARKDOWN, content, null);
    }

    public static OutboundMessage image(String filePath) {
        return new OutboundMessage(MessageKind.IMAGE, null, filePath);
    }

    public static OutboundMessage file(String filePath) {
        return new OutboundMessage(MessageKind.FILE, null, filePath);
    }
}
