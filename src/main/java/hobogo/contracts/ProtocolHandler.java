package hobogo.contracts;

/**
 * Defines the contract for a class that handles the text command loop. An
 * implementation parses commands from an input stream (a front-end or a
 * terminal) and orchestrates the engine's response.
 */
public interface ProtocolHandler {

    /**
     * Starts the main loop that continuously reads and processes commands
     * until a "quit" command is received or the input stream is closed.
     */
    void runLoop();

    /**
     * Processes a single command line.
     *
     * @return {@code true} when the command asks the loop to exit
     */
    boolean handle(String line);
}
