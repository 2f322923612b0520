package proofSearch;

import java.util.concurrent.atomic.AtomicInteger;
import tableau.ExpansionHook;
import tableau.Tableau;
import tableau.TableauNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks a node whose formula set repeats one of its ancestors'. Expanding it could only
 * replay the ancestor's expansion.
 */
public class LoopCheck implements ExpansionHook {
    private static final Logger LOG = LoggerFactory.getLogger(LoopCheck.class);

    private final AtomicInteger blocked = new AtomicInteger();

    @Override
    public boolean shouldExpand(Tableau tableau, TableauNode node, int remainingDepth) {
        for (var ancestor = node.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
            if (ancestor.getFormulas().equals(node.getFormulas())) {
                LOG.debug("Blocking w{} by ancestor w{}", node.getWorld(), ancestor.getWorld());
                blocked.incrementAndGet();
                return false;
            }
        }
        return true;
    }

    public int getBlockedCount() {
        return blocked.get();
    }
}
