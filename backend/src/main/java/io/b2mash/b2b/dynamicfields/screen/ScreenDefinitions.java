package io.b2mash.b2b.dynamicfields.screen;

import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import java.util.List;
import java.util.Optional;

/** The screens shipped with the engine. */
public final class ScreenDefinitions {

  private static final List<ScreenDefinition> ALL =
      List.of(
          ticket("AgentTicketPhone", "New Phone Ticket"),
          ticket("AgentTicketEmail", "New Email Ticket"),
          new ScreenDefinition("AgentTicketZoom", "Ticket Zoom", ObjectType.TICKET, false, true),
          ticket("AgentTicketClose", "Close Ticket"),
          ticket("AgentTicketNote", "Add Note"),
          ticket("AgentTicketMove", "Move Ticket"),
          ticket("AgentTicketOwner", "Change Owner"),
          ticket("AgentTicketPriority", "Change Priority"),
          ticket("CustomerTicketMessage", "Customer New Ticket"),
          new ScreenDefinition(
              "CustomerTicketZoom", "Customer Ticket View", ObjectType.TICKET, false, true),
          new ScreenDefinition("AgentArticleZoom", "Article View", ObjectType.ARTICLE, false, true),
          article("AgentArticleNote", "Agent Note Article"),
          article("AgentArticleClose", "Close Note Article"),
          article("AgentArticleReply", "Agent Reply Article"),
          article("CustomerArticleReply", "Customer Reply Article"));

  private ScreenDefinitions() {}

  public static List<ScreenDefinition> all() {
    return ALL;
  }

  public static Optional<ScreenDefinition> find(String key) {
    return ALL.stream().filter(screen -> screen.key().equals(key)).findFirst();
  }

  public static List<ScreenDefinition> forObjectType(ObjectType objectType) {
    return ALL.stream().filter(screen -> screen.objectType() == objectType).toList();
  }

  private static ScreenDefinition ticket(String key, String name) {
    return new ScreenDefinition(key, name, ObjectType.TICKET, true, false);
  }

  private static ScreenDefinition article(String key, String name) {
    return new ScreenDefinition(key, name, ObjectType.ARTICLE, true, false);
  }
}
