package org.uctbot.base.player.mcts.observer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.uctbot.base.player.mcts.event.TreeEvent;
import org.uctbot.base.player.mcts.event.TreeStartEvent;
import org.uctbot.base.player.mcts.model.SearchTree;
import org.uctbot.base.player.mcts.model.SearchTreeNode;
import org.uctbot.base.util.observer.Event;
import org.uctbot.base.util.observer.Observer;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.lang.reflect.Type;

/**
 * Dumps every decision tree it observes as JSON, one file per turn, under a fresh {@code Trees_<millis>} folder.
 */
public class TreeObserver implements Observer {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeHierarchyAdapter(SearchTree.class, new SearchTreeSerializer())
            .registerTypeHierarchyAdapter(SearchTreeNode.class, new SearchTreeNodeSerializer())
            .create();
    private final File baseDirectory;
    private File folder;

    public TreeObserver() {
        this(new File("."));
    }

    public TreeObserver(File baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public void observe(Event event) {
        try {
            if (event instanceof TreeStartEvent) {
                createFolder();
            } else if (event instanceof TreeEvent) {
                TreeEvent treeEvent = (TreeEvent) event;
                if (folder == null) {
                    createFolder();
                }

                File f = new File(folder, "Tree_" + treeEvent.getTurnNumber() + ".json");
                try (BufferedWriter bw = new BufferedWriter(new FileWriter(f))) {
                    bw.write(gson.toJson(treeEvent.getTree()));
                }
                LOGGER.debug("Wrote tree of turn {} to {}", treeEvent.getTurnNumber(), f);
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private void createFolder() throws IOException {
        folder = new File(baseDirectory, "Trees_" + System.currentTimeMillis());
        if (!folder.isDirectory() && !folder.mkdirs()) {
            throw new IOException("Could not create " + folder);
        }
    }

    public File getFolder() {
        return folder;
    }

    public String toJson(SearchTree<?, ?, ?> tree) {
        return gson.toJson(tree);
    }

    static class SearchTreeSerializer implements JsonSerializer<SearchTree<?, ?, ?>> {
        @Override
        public JsonElement serialize(SearchTree<?, ?, ?> src, Type typeOfSrc, JsonSerializationContext context) {
            JsonObject result = new JsonObject();
            result.addProperty("player", String.valueOf(src.getSearchingPlayer()));
            result.addProperty("iterations", src.getNumIterations());
            result.add("root", context.serialize(src.getRoot(), SearchTreeNode.class));
            return result;
        }
    }

    // The parent link is left out, it would make the output cyclic.
    static class SearchTreeNodeSerializer implements JsonSerializer<SearchTreeNode<?>> {
        @Override
        public JsonElement serialize(SearchTreeNode<?> src, Type typeOfSrc, JsonSerializationContext context) {
            JsonObject result = new JsonObject();
            if (!src.isRoot()) {
                result.addProperty("action", String.valueOf(src.getParentAction()));
            }
            result.addProperty("wins", src.getStatistics().getNumWins());
            result.addProperty("visits", src.getStatistics().getNumVisits());
            result.addProperty("untried", src.getUntriedActions().size());
            JsonArray children = new JsonArray();
            for (SearchTreeNode<?> child : src.getChildren()) {
                children.add(serialize(child, typeOfSrc, context));
            }
            result.add("children", children);
            return result;
        }
    }
}
