package org.p4hlir.p4Compiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.p4hlir.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Errors and warnings collected while running the analyzer. */
public class CompilerMessages {
    public static class Message {
        public final boolean warning;
        public final String errorType;
        public final String message;

        protected Message(boolean warning, String errorType, String message) {
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Message(Throwable e) {
            this(false, "This is a bug in the compiler (please report it to the developers)",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        Message(BaseCompilerException e) {
            this(false, e.getErrorKind(), e.getMessage());
        }

        public void format(StringBuilder output) {
            output.append(this.warning ? "warning: " : "error: ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final List<Message> messages;
    public int exitCode = 0;
    /** If true {@link #toString()} produces a JSON array. */
    public boolean emitJson;
    /** If true warnings are not shown. */
    public boolean quiet;

    public CompilerMessages() {
        this.messages = new ArrayList<>();
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning)
            this.setExitCode(1);
    }

    public void reportProblem(boolean warning, String errorType, String message) {
        this.reportError(new Message(warning, errorType, message));
    }

    public void reportError(BaseCompilerException e) {
        this.reportError(new Message(e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Message(e));
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public void show(PrintStream stream) {
        if (this.errorCount() + (this.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            if (this.quiet && message.warning)
                continue;
            result.add(message.toJson(mapper));
        }
        return result;
    }

    @Override
    public String toString() {
        if (this.emitJson)
            return this.toJson().toPrettyString();
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages) {
            if (this.quiet && message.warning)
                continue;
            message.format(builder);
        }
        return builder.toString();
    }
}
