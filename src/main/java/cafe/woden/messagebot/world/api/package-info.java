/** Types shared between the world model, its adapters and its subscribers. */
@NamedInterface("api")
package cafe.woden.messagebot.world.api;

import org.springframework.modulith.NamedInterface;
