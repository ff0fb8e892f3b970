package io.b2mash.orghierarchy.organization;

import io.b2mash.orghierarchy.exception.InvalidStateException;
import io.b2mash.orghierarchy.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree maintenance, sibling ordering and traversal rules shared by {@link OrganizationStore}
 * implementations. Stores supply node access through {@link Nodes}.
 */
final class TreeOrdering {

  private static final Logger log = LoggerFactory.getLogger(TreeOrdering.class);

  /** The node access a store provides to {@link #save(Organization, Nodes)}. */
  interface Nodes {

    Optional<Organization> findById(String id);

    /** Inserts or updates the row and returns the stored instance. */
    Organization write(Organization organization);

    /** Children of {@code parent} in sibling order; roots when {@code parent} is null. */
    List<Organization> children(Organization parent);

    /** Every stored node whose path starts with {@code prefix}, the node owning it included. */
    List<Organization> withPathPrefix(String prefix);
  }

  private TreeOrdering() {}

  /**
   * Writes {@code organization} and keeps the tree consistent: its path follows its parent, its
   * descendants follow it when it moved, and it is placed among its siblings when its parent or
   * internal type changed.
   *
   * @throws InvalidStateException if the parent is the organization itself or a descendant
   * @throws ResourceNotFoundException if the parent is not stored
   */
  static Organization save(Organization organization, Nodes nodes) {
    Organization parent = null;
    if (organization.getParentId() != null) {
      String parentId = organization.getParentId();
      parent =
          nodes
              .findById(parentId)
              .orElseThrow(() -> new ResourceNotFoundException("Organization", parentId));
      if (parent.getId().equals(organization.getId()) || organization.isAncestorOf(parent)) {
        throw new InvalidStateException(
            "Invalid parent",
            "Organization " + parentId + " cannot be the parent of " + organization.getId());
      }
      organization.attachParent(parent);
    }

    boolean reposition = organization.needsPlacement() || organization.getTreePath() == null;
    String oldPath = organization.getTreePath();
    int oldDepth = organization.getDepth();
    if (reposition) {
      organization.relocateUnder(parent);
    }

    Organization saved = nodes.write(organization);

    if (oldPath != null && !oldPath.equals(saved.getTreePath())) {
      rebaseDescendants(saved, oldPath, saved.getDepth() - oldDepth, nodes);
    }
    if (reposition) {
      place(nodes.children(parent), saved);
      saved.markPlaced();
    }
    return saved;
  }

  private static void rebaseDescendants(
      Organization moved, String oldPath, int depthDelta, Nodes nodes) {
    var descendants = nodes.withPathPrefix(oldPath);
    for (Organization descendant : descendants) {
      if (!descendant.getId().equals(moved.getId())) {
        descendant.rebase(oldPath, moved.getTreePath(), depthDelta);
      }
    }
    log.debug("Moved {} with {} descendants", moved.getId(), descendants.size());
  }

  /**
   * Places {@code node} among its siblings: it goes to the end of the group with the same internal
   * type, and affiliated organizations are kept ahead of normal ones. Positions are renumbered
   * from zero.
   *
   * @param siblings current siblings in position order, with or without {@code node}
   * @return the siblings in their new order, including {@code node}
   */
  static List<Organization> place(List<Organization> siblings, Organization node) {
    var ordered = new ArrayList<Organization>(siblings.size() + 1);
    for (Organization sibling : siblings) {
      if (!sibling.getId().equals(node.getId())) {
        ordered.add(sibling);
      }
    }
    ordered.add(node);
    // List.sort is stable, so existing relative order survives within each group
    ordered.sort(Comparator.comparingInt(org -> org.getInternalType().siblingRank()));
    for (int i = 0; i < ordered.size(); i++) {
      ordered.get(i).moveToPosition(i);
    }
    return ordered;
  }

  /**
   * Orders the descendants of {@code root} depth-first, children in sibling order. Nodes that are
   * not connected to {@code root} through {@code nodes} are dropped.
   */
  static List<Organization> depthFirst(Organization root, List<Organization> nodes) {
    Map<String, List<Organization>> childrenByParent = new HashMap<>();
    for (Organization node : nodes) {
      if (node.getParentId() != null) {
        childrenByParent.computeIfAbsent(node.getParentId(), key -> new ArrayList<>()).add(node);
      }
    }
    childrenByParent
        .values()
        .forEach(
            children -> children.sort(Comparator.comparingInt(Organization::getSiblingPosition)));

    var result = new ArrayList<Organization>();
    appendChildren(root.getId(), childrenByParent, result);
    return result;
  }

  private static void appendChildren(
      String parentId, Map<String, List<Organization>> childrenByParent, List<Organization> out) {
    for (Organization child : childrenByParent.getOrDefault(parentId, List.of())) {
      out.add(child);
      appendChildren(child.getId(), childrenByParent, out);
    }
  }
}
